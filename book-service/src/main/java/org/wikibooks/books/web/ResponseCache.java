package org.wikibooks.books.web;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.wikibooks.books.pagination.PageRequest;
import org.wikibooks.books.search.FilterSet;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Caches serialized response bodies by endpoint and normalized query.
 *
 * <p>The book collection never changes after startup, so a cached body is always identical to a freshly
 * computed one.</p>
 */
public class ResponseCache {
	private final Cache<String, String> bodies;
	private final boolean enabled;

	public ResponseCache(int maxEntries, Duration ttl) {
		this.enabled = !ttl.isZero();
		this.bodies = Caffeine.newBuilder()
				.maximumSize(maxEntries)
				.expireAfterWrite(enabled ? ttl : Duration.ofSeconds(1))
				.recordStats()
				.build();
	}

	/**
	 * Returns the cached body for {@code key}, computing and storing it on a miss.
	 */
	public String get(String key, Supplier<String> loader) {
		if (!enabled) {
			return loader.get();
		}
		return bodies.get(key, k -> loader.get());
	}

	public long size() {
		bodies.cleanUp();
		return bodies.estimatedSize();
	}

	public long hitCount() {
		return bodies.stats().hitCount();
	}

	/**
	 * Cache key for a request: the endpoint, then the filters in field order, then the effective paging.
	 * Requests that differ only in parameter order or in ignored parameters share a key.
	 */
	public static String key(String endpoint, FilterSet filters, PageRequest request) {
		StringBuilder key = new StringBuilder(endpoint).append('?');
		filters.criteria().forEach((field, query) ->
				key.append(field.key()).append('=').append(URLEncoder.encode(query, StandardCharsets.UTF_8)).append('&'));
		return key.append("page=").append(request.page())
				.append("&limit=").append(request.limit())
				.toString();
	}
}
