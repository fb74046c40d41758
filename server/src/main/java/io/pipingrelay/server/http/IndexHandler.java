package io.pipingrelay.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import org.eclipse.jetty.util.StringUtil;

/** Serves the interactive upload page on {@code /}. */
public final class IndexHandler implements Handler {

    private final String page;

    public IndexHandler(String version) {
        this.page = StaticPages.read(StaticPages.INDEX_HTML).replace("{{version}}", StringUtil.sanitizeXmlString(version));
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("text/html; charset=utf-8");
        ctx.result(page);
    }
}
