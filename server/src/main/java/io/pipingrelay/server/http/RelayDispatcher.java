package io.pipingrelay.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.pipingrelay.core.engine.ReceiverRequest;
import io.pipingrelay.core.engine.RendezvousEngine;
import io.pipingrelay.core.engine.SenderRequest;
import io.pipingrelay.core.model.HttpHeaders;
import io.pipingrelay.core.model.TransferOutcome;
import io.pipingrelay.core.registry.RejectionReason;
import io.pipingrelay.core.registry.ReservedPaths;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes every request on every path.
 *
 * <p>
 * Order: {@code OPTIONS} is a CORS preflight on any path; reserved paths get
 * their fixed page on {@code GET}/{@code HEAD} and a 400 on
 * {@code POST}/{@code PUT}; any other path is a rendezvous point where
 * {@code GET}/{@code HEAD} receive and {@code POST}/{@code PUT} send. Other
 * methods never reach this handler; the method filter installed by
 * {@link RelayApp} answers them with 405.
 *
 * <p>
 * Senders and receivers block the Jetty worker thread until their transfer is
 * over.
 */
public final class RelayDispatcher implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(RelayDispatcher.class);

    private final RendezvousEngine engine;
    private final Handler preflight;
    private final Map<String, Handler> reserved;

    public RelayDispatcher(RendezvousEngine engine, Handler preflight, Map<String, Handler> reserved) {
        this.engine = engine;
        this.preflight = preflight;
        this.reserved = Map.copyOf(reserved);
    }

    @Override
    public void handle(Context ctx) throws Exception {
        String method = ctx.req().getMethod();
        String path = ctx.path();

        if ("OPTIONS".equals(method)) {
            preflight.handle(ctx);
            return;
        }
        boolean receiving = "GET".equals(method) || "HEAD".equals(method);
        if (ReservedPaths.isReserved(path)) {
            Handler page = reserved.get(path);
            if (receiving && page != null) {
                page.handle(ctx);
            } else {
                rejectReserved(ctx);
            }
            return;
        }

        ServletResponseSender response = new ServletResponseSender(ctx.req(), ctx.res());
        TransferOutcome outcome;
        if (receiving) {
            outcome = engine.handleReceiver(
                    new ReceiverRequest(path, ctx.queryParam("n"), "HEAD".equals(method)), response);
        } else {
            // obtaining the stream makes Jetty answer "Expect: 100-continue"
            ServletInputStream body = ctx.req().getInputStream();
            outcome = engine.handleSender(
                    new SenderRequest(path, ctx.queryParam("n"), requestHeaders(ctx.req()), body), response);
        }
        LOG.debug("{} {} -> {}", method, path, outcome);
    }

    private static void rejectReserved(Context ctx) {
        ctx.status(400);
        ctx.header("Access-Control-Allow-Origin", "*");
        ctx.contentType("text/plain; charset=utf-8");
        ctx.result(RejectionReason.RESERVED_PATH.senderMessage().getBytes(StandardCharsets.UTF_8));
    }

    static HttpHeaders requestHeaders(HttpServletRequest request) {
        HttpHeaders.Builder builder = HttpHeaders.builder();
        Enumeration<String> names = request.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            Enumeration<String> values = request.getHeaders(name);
            while (values != null && values.hasMoreElements()) {
                builder.add(name, values.nextElement());
            }
        }
        return builder.build();
    }
}
