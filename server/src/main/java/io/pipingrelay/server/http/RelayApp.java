package io.pipingrelay.server.http;

import io.javalin.Javalin;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import io.pipingrelay.core.engine.RendezvousEngine;
import io.pipingrelay.core.registry.PathRegistry;
import io.pipingrelay.core.registry.ReservedPaths;
import io.pipingrelay.server.config.RelayConfig;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and runs the relay server.
 *
 * <p>
 * Startup:
 * <ol>
 * <li>Validate the HTTPS certificate and key, if HTTPS is enabled</li>
 * <li>Create the path registry and the rendezvous engine</li>
 * <li>Configure Jetty: bounded worker pool, HTTP connector, optional HTTPS
 * connector, no response compression</li>
 * <li>Install the method filter and route every path to
 * {@link RelayDispatcher}</li>
 * <li>Start Javalin</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.pipingrelay.server.RelayMain} so tests can start and
 * stop the server in-process.
 */
public final class RelayApp {

    private static final Logger LOG = LoggerFactory.getLogger(RelayApp.class);

    /** Methods with a meaning on every path; anything else is a 405. */
    static final Set<String> ALLOWED_METHODS = Set.of("GET", "HEAD", "POST", "PUT", "OPTIONS");

    private static final List<HandlerType> ROUTED_TYPES =
            List.of(HandlerType.GET, HandlerType.HEAD, HandlerType.POST, HandlerType.PUT, HandlerType.OPTIONS);

    private final Javalin app;
    private final RendezvousEngine engine;
    private final ServerConnector httpConnector;
    private final ServerConnector httpsConnector;

    private RelayApp(Javalin app, RendezvousEngine engine, ServerConnector httpConnector,
            ServerConnector httpsConnector) {
        this.app = app;
        this.engine = engine;
        this.httpConnector = httpConnector;
        this.httpsConnector = httpsConnector;
    }

    /**
     * Starts the relay and returns once both connectors are listening.
     *
     * @throws IllegalStateException if the HTTPS material is invalid
     */
    public static RelayApp start(RelayConfig config) {
        long startTime = System.nanoTime();

        TlsConfigValidator.validate(config.tls());

        PathRegistry registry = new PathRegistry();
        RendezvousEngine engine = new RendezvousEngine(registry, config.chunkSize(), new MultipartFormReader(),
                Duration.ofMillis(config.livenessCheckMs()));
        String version = StaticPages.version();
        Map<String, Handler> reserved = Map.of(
                ReservedPaths.INDEX, new IndexHandler(version),
                ReservedPaths.NO_SCRIPT, new NoScriptHandler(),
                ReservedPaths.VERSION, new VersionHandler(version),
                ReservedPaths.HELP, new HelpHandler(version),
                ReservedPaths.ROBOTS_TXT, ctx -> ctx.status(404),
                ReservedPaths.FAVICON_ICO, ctx -> ctx.status(204));
        RelayDispatcher dispatcher = new RelayDispatcher(engine, new PreflightHandler(), reserved);

        AtomicReference<ServerConnector> http = new AtomicReference<>();
        AtomicReference<ServerConnector> https = new AtomicReference<>();
        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.http.disableCompression();
            javalinConfig.jetty.threadPool = new QueuedThreadPool(config.maxThreads(), config.minThreads());
            javalinConfig.jetty.addConnector((server, httpConfig) -> {
                ServerConnector connector = new ServerConnector(server, new HttpConnectionFactory(httpConfig));
                connector.setHost(config.host());
                connector.setPort(config.httpPort());
                connector.setIdleTimeout(config.idleTimeoutMs());
                http.set(connector);
                return connector;
            });
            if (config.tls().enabled()) {
                TlsConfigurator.configureHttps(
                        javalinConfig, config.host(), config.tls(), config.idleTimeoutMs(), https::set);
            }
        });

        app.before(ctx -> {
            String method = ctx.req().getMethod();
            if (!ALLOWED_METHODS.contains(method)) {
                ctx.status(405);
                ctx.header("Allow", PreflightHandler.ALLOWED_METHODS);
                ctx.header("Access-Control-Allow-Origin", "*");
                ctx.contentType("text/plain; charset=utf-8");
                ctx.result(("[ERROR] Unsupported method: " + method + ".\n").getBytes(StandardCharsets.UTF_8));
                ctx.skipRemainingHandlers();
            }
        });
        for (HandlerType type : ROUTED_TYPES) {
            app.addHttpHandler(type, "/", dispatcher);
            app.addHttpHandler(type, "/<path>", dispatcher);
        }

        app.start();

        RelayApp relay = new RelayApp(app, engine, http.get(), https.get());
        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info("piping-relay {} started: http={}, https={}, maxThreads={}, chunkSize={}, startupMs={}",
                version,
                relay.httpPort(),
                relay.httpsPort() > 0 ? relay.httpsPort() : "off",
                config.maxThreads(),
                config.chunkSize(),
                elapsedMs);
        return relay;
    }

    /** Bound HTTP port. */
    public int httpPort() {
        return httpConnector.getLocalPort();
    }

    /** Bound HTTPS port, or {@code -1} when HTTPS is off. */
    public int httpsPort() {
        return httpsConnector != null ? httpsConnector.getLocalPort() : -1;
    }

    public RendezvousEngine engine() {
        return engine;
    }

    /** Stops accepting connections and aborts transfers still running. */
    public void stop() {
        app.stop();
        LOG.info("piping-relay stopped");
    }
}
