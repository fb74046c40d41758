package io.pipingrelay.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Answers CORS preflight ({@code OPTIONS}) on any path, so browsers on other
 * origins may send to and receive from the relay.
 */
public final class PreflightHandler implements Handler {

    static final String ALLOWED_METHODS = "GET, HEAD, POST, PUT, OPTIONS";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.header("Access-Control-Allow-Origin", "*");
        ctx.header("Access-Control-Allow-Methods", ALLOWED_METHODS);
        ctx.header("Access-Control-Allow-Headers", "Content-Type, Content-Disposition");
        ctx.header("Access-Control-Max-Age", "86400");
        ctx.header("Content-Length", "0");
    }
}
