package org.wikibooks.books.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Typed configuration for the Book Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. The short environment names
 * used by existing deployments are honoured:
 * <ul>
 *   <li>{@code PORT} overrides {@code server.port}</li>
 *   <li>{@code DATA_FILE} overrides {@code books.data.file}</li>
 *   <li>{@code RATE_LIMIT} overrides {@code ratelimit.requests.per.day}</li>
 *   <li>{@code CACHE_DEFAULT_TIMEOUT} overrides {@code cache.ttl.seconds}</li>
 * </ul>
 * Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record BookServiceConfig(
    int serverPort,
    Books books,
    RateLimit rateLimit,
    Cache cache
) {
    /** Data source and pagination settings. */
    public record Books(Path dataFile, int defaultLimit, int maxLimit) {}

    /** Per-client request quotas, counted separately for each endpoint. */
    public record RateLimit(boolean enabled, int requestsPerDay, int searchRequestsPerDay) {}

    /** Response cache settings. A zero TTL disables caching. */
    public record Cache(Duration ttl, int maxEntries) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link BookServiceConfig}
     */
    public static BookServiceConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        return fromProperties(properties);
    }

    /**
     * Builds the configuration from an already-assembled property set, applying the environment aliases.
     */
    public static BookServiceConfig fromProperties(Properties properties) {
        applyAlias(properties, "PORT", "server.port");
        applyAlias(properties, "DATA_FILE", "books.data.file");
        applyAlias(properties, "RATE_LIMIT", "ratelimit.requests.per.day");
        applyAlias(properties, "CACHE_DEFAULT_TIMEOUT", "cache.ttl.seconds");
        return from(properties);
    }

    private static BookServiceConfig from(Properties p) {
        return new BookServiceConfig(
            requireInt(p, "server.port"),
            readBooks(p),
            readRateLimit(p),
            readCache(p)
        );
    }

    private static Books readBooks(Properties p) {
        int defaultLimit = requirePositiveInt(p, "books.default.limit");
        int maxLimit = requirePositiveInt(p, "books.max.limit");
        if (defaultLimit > maxLimit) {
            throw new IllegalStateException(
                "books.default.limit (" + defaultLimit + ") must not exceed books.max.limit (" + maxLimit + ")");
        }
        return new Books(Path.of(requireString(p, "books.data.file")), defaultLimit, maxLimit);
    }

    private static RateLimit readRateLimit(Properties p) {
        return new RateLimit(
            Boolean.parseBoolean(requireString(p, "ratelimit.enabled")),
            requirePositiveInt(p, "ratelimit.requests.per.day"),
            requirePositiveInt(p, "ratelimit.search.requests.per.day")
        );
    }

    private static Cache readCache(Properties p) {
        int ttlSeconds = requireInt(p, "cache.ttl.seconds");
        if (ttlSeconds < 0) {
            throw new IllegalStateException("cache.ttl.seconds must not be negative: " + ttlSeconds);
        }
        return new Cache(Duration.ofSeconds(ttlSeconds), requirePositiveInt(p, "cache.max.entries"));
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = BookServiceConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static void applyAlias(Properties properties, String alias, String key) {
        String value = trimToNull(properties.getProperty(alias));
        if (value != null) {
            properties.setProperty(key, value);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static int requirePositiveInt(Properties properties, String key) {
        int value = requireInt(properties, key);
        if (value < 1) {
            throw new IllegalStateException("Configuration '" + key + "' must be positive: " + value);
        }
        return value;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
