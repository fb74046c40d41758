package io.pipingrelay.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import org.eclipse.jetty.util.StringUtil;

/**
 * Serves the form-only page on {@code /noscript}. The form posts
 * {@code multipart/form-data} to the path given as {@code ?path=}, so it works
 * without JavaScript.
 */
public final class NoScriptHandler implements Handler {

    private final String template;

    public NoScriptHandler() {
        this.template = StaticPages.read(StaticPages.NO_SCRIPT_HTML);
    }

    @Override
    public void handle(Context ctx) {
        String path = ctx.queryParam("path");
        String target = path == null ? "" : path.startsWith("/") ? path : "/" + path;
        ctx.status(200);
        ctx.contentType("text/html; charset=utf-8");
        ctx.result(template.replace("{{path}}", StringUtil.sanitizeXmlString(target)));
    }
}
