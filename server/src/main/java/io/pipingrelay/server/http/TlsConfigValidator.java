package io.pipingrelay.server.http;

import io.pipingrelay.server.config.TlsConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the HTTPS certificate and key at startup, so that a bad path or a
 * mismatched key fails fast with a readable message instead of a handshake
 * error on the first client.
 */
public final class TlsConfigValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TlsConfigValidator.class);

    private TlsConfigValidator() {}

    /**
     * Validates the HTTPS configuration; does nothing when HTTPS is off.
     *
     * @throws IllegalStateException if a file is missing, unreadable or
     *                               unparseable, or the key does not match
     */
    public static void validate(TlsConfig tlsConfig) {
        if (!tlsConfig.enabled()) {
            return;
        }
        Path crt = requireReadable("TLS certificate", tlsConfig.crtPath(), "--crt-path");
        Path key = requireReadable("TLS private key", tlsConfig.keyPath(), "--key-path");
        loadKeyStore(crt, key, "validation".toCharArray());
        LOG.info("TLS certificate and key validated: crt={}, key={}", crt, key);
    }

    /**
     * Loads the key material into a key store, translating failures into
     * {@link IllegalStateException}.
     */
    static KeyStore loadKeyStore(Path crt, Path key, char[] password) {
        try {
            return PemKeyStores.load(crt, key, password);
        } catch (Exception e) {
            throw new IllegalStateException(
                    "TLS certificate/key could not be loaded (" + crt + ", " + key + "): " + e.getMessage(), e);
        }
    }

    private static Path requireReadable(String label, String path, String flag) {
        if (path == null || path.isBlank()) {
            throw new IllegalStateException("HTTPS enabled but no " + label + " configured. Set " + flag + ".");
        }
        Path file = Path.of(path);
        if (!Files.exists(file)) {
            throw new IllegalStateException(label + " file does not exist: " + path);
        }
        if (!Files.isReadable(file)) {
            throw new IllegalStateException(label + " file is not readable: " + path);
        }
        return file;
    }
}
