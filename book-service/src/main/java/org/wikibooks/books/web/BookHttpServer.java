package org.wikibooks.books.web;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.plugin.bundled.CorsPluginConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikibooks.books.controller.BookController;
import org.wikibooks.books.model.ErrorResponse;

/** HTTP server wiring for the Book Service. */
public final class BookHttpServer {
    private static final Logger logger = LoggerFactory.getLogger(BookHttpServer.class);
    private static final Gson gson = new Gson();
    private static final String JSON = "application/json";

    private BookHttpServer() {}

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param port port to bind
     * @param controller controller that registers routes
     * @param rateLimiter per-client quotas, or {@code null} to disable rate limiting
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, BookController controller, RequestRateLimiter rateLimiter) {
        return create(controller, rateLimiter).start(port);
    }

    /**
     * Builds the Javalin app with middleware, error mapping and routes, without binding a port.
     */
    public static Javalin create(BookController controller, RequestRateLimiter rateLimiter) {
        Javalin app = Javalin.create(cfg -> {
            cfg.showJavalinBanner = false;
            cfg.bundledPlugins.enableCors(cors -> cors.addRule(CorsPluginConfig.CorsRule::anyHost));
        });

        if (rateLimiter != null) {
            // keyed on the matched route so "/all/" and "/all" share one quota
            app.beforeMatched(ctx -> rateLimiter.acquire(ctx.ip(), ctx.endpointHandlerPath()));
        }
        app.after(SecurityHeaders::apply);

        app.exception(RateLimitExceededException.class, (e, ctx) -> {
            ctx.status(429).contentType(JSON)
                    .result(gson.toJson(new ErrorResponse("Rate limit exceeded. Try again later.")));
        });
        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).contentType(JSON)
                    .result(gson.toJson(new ErrorResponse("Internal server error")));
        });

        controller.registerRoutes(app);
        return app;
    }
}
