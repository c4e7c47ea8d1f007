package org.wikibooks.books.web;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-client request quotas.
 *
 * <p>Each (client, endpoint) pair gets its own Resilience4j {@link RateLimiter}, so traffic on one endpoint
 * never consumes another endpoint's quota. Paths without a configured quota are not limited.</p>
 */
public class RequestRateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RequestRateLimiter.class);
    private static final long MAX_TRACKED_CLIENTS = 100_000;

    private final Map<String, RateLimiterConfig> configsByEndpoint;
    private final Cache<String, RateLimiter> limiters;

    /**
     * @param quotasByEndpoint permitted requests per {@code period}, keyed by request path
     * @param period length of one quota window
     */
    public RequestRateLimiter(Map<String, Integer> quotasByEndpoint, Duration period) {
        this.configsByEndpoint = Map.copyOf(quotasByEndpoint.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> quotaConfig(e.getValue(), period))));
        this.limiters = Caffeine.newBuilder()
                .maximumSize(MAX_TRACKED_CLIENTS)
                .expireAfterAccess(period)
                .build();
        logger.info("Rate limiter initialized with quotas {} per {}", quotasByEndpoint, period);
    }

    /**
     * Consumes one permit for {@code clientId} on {@code endpoint}.
     *
     * @throws RateLimitExceededException if the quota for this window is used up
     */
    public void acquire(String clientId, String endpoint) {
        RateLimiterConfig config = configsByEndpoint.get(endpoint);
        if (config == null) {
            return;
        }

        String key = clientId + "|" + endpoint;
        RateLimiter limiter = limiters.get(key, k -> RateLimiter.of(k, config));
        if (!limiter.acquirePermission()) {
            logger.warn("Rate limit exceeded: client={}, endpoint={}", clientId, endpoint);
            throw new RateLimitExceededException(endpoint);
        }
    }

    private static RateLimiterConfig quotaConfig(int limitForPeriod, Duration period) {
        return RateLimiterConfig.custom()
                .limitRefreshPeriod(period)
                .limitForPeriod(limitForPeriod)
                .timeoutDuration(Duration.ZERO)
                .build();
    }
}
