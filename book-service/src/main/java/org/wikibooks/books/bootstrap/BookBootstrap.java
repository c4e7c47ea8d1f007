package org.wikibooks.books.bootstrap;

import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikibooks.books.BookServiceContext;
import org.wikibooks.books.config.BookServiceConfig;
import org.wikibooks.books.controller.BookController;
import org.wikibooks.books.loader.LoadResult;
import org.wikibooks.books.loader.NdjsonBookLoader;
import org.wikibooks.books.web.BookHttpServer;

import java.io.IOException;

/**
 * Application bootstrapper for the Book Service.
 *
 * <p>Loads configuration, reads the data source once, starts the HTTP API, and registers a JVM shutdown
 * hook.</p>
 */
public final class BookBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(BookBootstrap.class);

    private BookBootstrap() {}

    /**
     * Starts the Book Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            start();
        } catch (Exception e) {
            logger.error("Failed to start Book Service", e);
            System.exit(1);
        }
    }

    private static void start() {
        logger.info("API startup");
        BookServiceConfig cfg = BookServiceConfig.load();
        BookServiceContext context = BookServiceContext.create(cfg, loadBooks(cfg));
        Javalin app = startHttp(context);
        addShutdownHook(app);
        logger.info("Book Service started successfully on port {}.", cfg.serverPort());
    }

    /**
     * Reads the data source. A missing file yields an empty collection; an unreadable one aborts startup.
     */
    static LoadResult loadBooks(BookServiceConfig cfg) {
        try {
            return new NdjsonBookLoader(cfg.books().dataFile()).load();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read data source " + cfg.books().dataFile(), e);
        }
    }

    private static Javalin startHttp(BookServiceContext context) {
        BookController controller = new BookController(context);
        return BookHttpServer.start(context.config().serverPort(), controller, context.rateLimiter());
    }

    private static void addShutdownHook(Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Book Service...");
        app.stop();
        logger.info("Book Service stopped.");
    }
}
