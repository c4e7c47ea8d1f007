package org.wikibooks.books.controller;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.wikibooks.books.BookServiceContext;
import org.wikibooks.books.loader.LoadResult;
import org.wikibooks.books.model.BookPageResponse;
import org.wikibooks.books.pagination.PageRequest;
import org.wikibooks.books.search.FilterSet;
import org.wikibooks.books.service.BookQueryService;
import org.wikibooks.books.web.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public class BookController {
	private static final Logger logger = LoggerFactory.getLogger(BookController.class);
	private static final Gson gson = new GsonBuilder().serializeNulls().create();
	private static final String JSON = "application/json";
	private static final String VERSION = "1.0.0";

	private final BookQueryService queryService;
	private final ResponseCache responseCache;
	private final LoadResult loadResult;
	private final int defaultLimit;
	private final int maxLimit;
	private final String openApiDocument;
	private final String docsPage;

	public BookController(BookServiceContext context) {
		this.queryService = context.queryService();
		this.responseCache = context.responseCache();
		this.loadResult = context.loadResult();
		this.defaultLimit = context.config().books().defaultLimit();
		this.maxLimit = context.config().books().maxLimit();
		this.openApiDocument = readResource("openapi.json");
		this.docsPage = readResource("docs.html");
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get(BookServiceContext.ALL_ENDPOINT, this::handleAll);

		app.get(BookServiceContext.SEARCH_ENDPOINT, this::handleSearch);

		app.get("/swagger.json", ctx -> ctx.contentType(JSON).result(openApiDocument));

		app.get("/docs", ctx -> ctx.html(docsPage));

		logger.info("Book routes registered");
	}

	/**
	 * GET /health
	 * Liveness check with the size of the loaded collection
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new LinkedHashMap<>();
		health.put("status", "healthy");
		health.put("version", VERSION);
		health.put("service", "book-service");
		health.put("total_books", queryService.totalBooks());
		health.put("skipped_lines", loadResult.skippedLines());
		health.put("timestamp", System.currentTimeMillis());

		ctx.contentType(JSON).result(gson.toJson(health));
	}

	/**
	 * GET /all?limit={limit}&page={page}
	 * Page through every book
	 */
	private void handleAll(Context ctx) {
		PageRequest request = pageRequest(ctx);
		logger.info("All request: page={}, limit={}", request.page(), request.limit());

		String key = ResponseCache.key(BookServiceContext.ALL_ENDPOINT, FilterSet.empty(), request);
		String body = responseCache.get(key, () -> gson.toJson(queryService.listAll(request)));

		ctx.status(200).contentType(JSON).result(body);
	}

	/**
	 * GET /search?name=&author=&language=&genre=&publisher=&release_date=&media_type=&pages=&isbn=&limit=&page=
	 * Fuzzy search across any subset of the book fields
	 */
	private void handleSearch(Context ctx) {
		PageRequest request = pageRequest(ctx);
		FilterSet filters = FilterSet.fromQueryParams(ctx.queryParamMap());
		logger.info("Search request: filters={}, page={}, limit={}", filters.criteria(), request.page(), request.limit());

		String key = ResponseCache.key(BookServiceContext.SEARCH_ENDPOINT, filters, request);
		String body = responseCache.get(key, () -> {
			BookPageResponse response = queryService.search(filters, request);
			logger.info("Search matched {} books", response.total());
			return gson.toJson(response);
		});

		ctx.status(200).contentType(JSON).result(body);
	}

	private PageRequest pageRequest(Context ctx) {
		return PageRequest.parse(ctx.queryParam("page"), ctx.queryParam("limit"), defaultLimit, maxLimit);
	}

	private static String readResource(String name) {
		try (InputStream in = BookController.class.getClassLoader().getResourceAsStream(name)) {
			if (in == null) {
				throw new IllegalStateException("Missing classpath resource: " + name);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read " + name, e);
		}
	}
}
