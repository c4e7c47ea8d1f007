package org.wikibooks.books.web;

/**
 * Thrown when a client has used up its quota for an endpoint. Mapped to HTTP 429.
 */
public class RateLimitExceededException extends RuntimeException {
    private final String endpoint;

    public RateLimitExceededException(String endpoint) {
        super("Rate limit exceeded for " + endpoint);
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }
}
