package io.pipingrelay.server.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/** Classpath resources served on reserved paths. */
final class StaticPages {

    static final String INDEX_HTML = "/static/index.html";
    static final String NO_SCRIPT_HTML = "/static/noscript.html";
    static final String VERSION_PROPERTIES = "/piping-relay-version.properties";

    private StaticPages() {}

    /**
     * Reads a UTF-8 text resource.
     *
     * @throws IllegalStateException if the resource is not on the classpath
     */
    static String read(String resource) {
        try (InputStream in = StaticPages.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource: " + resource, e);
        }
    }

    /** The build's project version, or {@code "dev"} when run outside a packaged build. */
    static String version() {
        Properties properties = new Properties();
        try (InputStream in = StaticPages.class.getResourceAsStream(VERSION_PROPERTIES)) {
            if (in == null) {
                return "dev";
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + VERSION_PROPERTIES, e);
        }
        String version = properties.getProperty("version", "dev").trim();
        return version.isEmpty() || version.startsWith("${") ? "dev" : version;
    }
}
