package org.wikibooks.books.web;

import io.javalin.http.Context;

/** Standard hardening headers added to every response. */
public final class SecurityHeaders {
    private SecurityHeaders() {}

    public static void apply(Context ctx) {
        ctx.header("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
        ctx.header("X-Content-Type-Options", "nosniff");
        ctx.header("X-Frame-Options", "SAMEORIGIN");
        ctx.header("X-XSS-Protection", "1; mode=block");
    }
}
