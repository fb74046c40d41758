package io.pipingrelay.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/** Serves {@code /version}: the version followed by a newline. */
public final class VersionHandler implements Handler {

    private final String body;

    public VersionHandler(String version) {
        this.body = version + "\n";
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("text/plain; charset=utf-8");
        ctx.result(body);
    }
}
