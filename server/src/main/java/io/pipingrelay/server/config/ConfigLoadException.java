package io.pipingrelay.server.config;

/**
 * Thrown when the relay cannot be configured: missing or unparseable YAML
 * file, malformed command-line flag or environment value, or an inconsistent
 * combination such as HTTPS without certificate paths. The message is meant
 * for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
