package org.wikibooks.books;

import org.wikibooks.books.config.BookServiceConfig;
import org.wikibooks.books.loader.LoadResult;
import org.wikibooks.books.repository.BookRepository;
import org.wikibooks.books.repository.InMemoryBookRepository;
import org.wikibooks.books.search.FuzzySearchEngine;
import org.wikibooks.books.service.BookQueryService;
import org.wikibooks.books.web.RequestRateLimiter;
import org.wikibooks.books.web.ResponseCache;

import java.time.Duration;
import java.util.Map;

/**
 * Everything the service builds once at startup and shares across requests.
 *
 * @param rateLimiter per-client quotas, {@code null} when rate limiting is disabled
 */
public record BookServiceContext(
    BookServiceConfig config,
    LoadResult loadResult,
    BookRepository repository,
    BookQueryService queryService,
    RequestRateLimiter rateLimiter,
    ResponseCache responseCache
) {
    public static final String ALL_ENDPOINT = "/all";
    public static final String SEARCH_ENDPOINT = "/search";

    /**
     * Wires the store, query service and middleware state around an already-loaded collection.
     */
    public static BookServiceContext create(BookServiceConfig config, LoadResult loadResult) {
        BookRepository repository = new InMemoryBookRepository(loadResult.records());
        BookQueryService queryService = new BookQueryService(repository, new FuzzySearchEngine());
        return new BookServiceContext(
            config,
            loadResult,
            repository,
            queryService,
            buildRateLimiter(config.rateLimit()),
            new ResponseCache(config.cache().maxEntries(), config.cache().ttl())
        );
    }

    private static RequestRateLimiter buildRateLimiter(BookServiceConfig.RateLimit rateLimit) {
        if (!rateLimit.enabled()) {
            return null;
        }
        return new RequestRateLimiter(
            Map.of(
                ALL_ENDPOINT, rateLimit.requestsPerDay(),
                SEARCH_ENDPOINT, rateLimit.searchRequestsPerDay()
            ),
            Duration.ofDays(1)
        );
    }
}
