package io.pipingrelay.server.config;

/**
 * HTTPS listener configuration.
 *
 * @param enabled   whether the HTTPS connector is started next to HTTP
 * @param httpsPort HTTPS listen port, {@code null} if unset
 * @param crtPath   PEM certificate chain, {@code null} if unset
 * @param keyPath   PEM (PKCS#8) private key, {@code null} if unset
 */
public record TlsConfig(boolean enabled, Integer httpsPort, String crtPath, String keyPath) {

    /** HTTPS off. */
    public static final TlsConfig DISABLED = new TlsConfig(false, null, null, null);
}
