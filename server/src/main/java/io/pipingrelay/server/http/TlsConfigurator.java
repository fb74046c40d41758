package io.pipingrelay.server.http;

import io.javalin.config.JavalinConfig;
import io.pipingrelay.server.config.TlsConfig;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.function.Consumer;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.SecureRequestCustomizer;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.SslConnectionFactory;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds an HTTPS connector to Javalin's embedded Jetty, next to the plain HTTP
 * one.
 *
 * <p>
 * The PEM material is loaded once into an in-memory key store protected by a
 * random per-process password.
 */
final class TlsConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(TlsConfigurator.class);

    private TlsConfigurator() {}

    /**
     * @param onCreated receives the connector once Jetty builds it, so the
     *                  caller can read its bound port after start
     */
    static void configureHttps(JavalinConfig javalinConfig, String host, TlsConfig tlsConfig, long idleTimeoutMs,
            Consumer<ServerConnector> onCreated) {
        byte[] secret = new byte[24];
        new SecureRandom().nextBytes(secret);
        String password = Base64.getEncoder().encodeToString(secret);

        SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();
        sslContextFactory.setKeyStore(TlsConfigValidator.loadKeyStore(
                Path.of(tlsConfig.crtPath()), Path.of(tlsConfig.keyPath()), password.toCharArray()));
        sslContextFactory.setKeyStorePassword(password);

        javalinConfig.jetty.addConnector((server, httpConfig) -> {
            HttpConfiguration httpsConfig = new HttpConfiguration(httpConfig);
            // relays are reached under arbitrary host names; do not enforce SNI
            httpsConfig.addCustomizer(new SecureRequestCustomizer(false));

            ServerConnector sslConnector = new ServerConnector(
                    server,
                    new SslConnectionFactory(sslContextFactory, "http/1.1"),
                    new HttpConnectionFactory(httpsConfig));
            sslConnector.setHost(host);
            sslConnector.setPort(tlsConfig.httpsPort());
            sslConnector.setIdleTimeout(idleTimeoutMs);

            LOG.info("HTTPS connector configured: port={}, crt={}", tlsConfig.httpsPort(), tlsConfig.crtPath());
            onCreated.accept(sslConnector);
            return sslConnector;
        });
    }
}
