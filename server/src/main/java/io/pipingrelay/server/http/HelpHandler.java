package io.pipingrelay.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Serves {@code /help}: curl usage examples addressed to the URL the client
 * used to reach the relay.
 */
public final class HelpHandler implements Handler {

    private final String version;

    public HelpHandler(String version) {
        this.version = version;
    }

    @Override
    public void handle(Context ctx) {
        String host = ctx.header("Host");
        String base = ctx.scheme() + "://" + (host != null ? host : "localhost");
        ctx.status(200);
        ctx.contentType("text/plain; charset=utf-8");
        ctx.result(helpText(base, version));
    }

    static String helpText(String base, String version) {
        String url = base + "/mypath";
        return "Help for piping-relay " + version + "\n"
                + "\n"
                + "======= Get  =======\n"
                + "curl " + url + "\n"
                + "\n"
                + "======= Send =======\n"
                + "# Send a file\n"
                + "curl -T myfile " + url + "\n"
                + "\n"
                + "# Send a text\n"
                + "echo 'hello!' | curl -T - " + url + "\n"
                + "\n"
                + "# Send a directory (zip)\n"
                + "zip -q -r - ./mydir | curl -T - " + url + "\n"
                + "\n"
                + "# Send a directory (tar.gz)\n"
                + "tar zfcp - ./mydir | curl -T - " + url + "\n"
                + "\n"
                + "# Encryption\n"
                + "## Send\n"
                + "cat myfile | openssl aes-256-cbc | curl -T - " + url + "\n"
                + "## Get\n"
                + "curl " + url + " | openssl aes-256-cbc -d\n"
                + "\n"
                + "======= Multiple receivers =======\n"
                + "# Send to 3 receivers\n"
                + "curl -T myfile '" + url + "?n=3'\n"
                + "# Each receiver\n"
                + "curl '" + url + "?n=3'\n";
    }
}
