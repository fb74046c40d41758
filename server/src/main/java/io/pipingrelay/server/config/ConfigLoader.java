package io.pipingrelay.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link RelayConfig} from, in increasing precedence: built-in
 * defaults, a YAML file, environment variables and command-line flags.
 *
 * <p>
 * The YAML file is {@code --config <file>} when given (it must exist), else
 * {@code piping-relay.yaml} in the working directory when present. An
 * environment variable counts as set only if it is defined and non-blank.
 *
 * <p>
 * Command-line flags: {@code --http-port <n>}, {@code --enable-https},
 * {@code --https-port <n>}, {@code --crt-path <file>},
 * {@code --key-path <file>} and {@code --config <file>}. Both
 * {@code --flag value} and {@code --flag=value} are accepted.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "piping-relay.yaml";

    private static final String CONFIG = "--config";
    private static final String HTTP_PORT = "--http-port";
    private static final String ENABLE_HTTPS = "--enable-https";
    private static final String HTTPS_PORT = "--https-port";
    private static final String CRT_PATH = "--crt-path";
    private static final String KEY_PATH = "--key-path";
    private static final Set<String> VALUE_FLAGS = Set.of(CONFIG, HTTP_PORT, HTTPS_PORT, CRT_PATH, KEY_PATH);

    private ConfigLoader() {
        // utility class
    }

    /** Loads the configuration for {@code main}, reading {@link System#getenv}. */
    public static RelayConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Loads the configuration from command-line arguments and the supplied
     * environment lookup.
     *
     * @throws ConfigLoadException on any invalid input
     */
    public static RelayConfig load(String[] args, Function<String, String> envLookup) {
        Map<String, String> flags = parseArgs(args);
        RelayConfig.Builder builder = RelayConfig.builder();

        Path configPath = resolveConfigPath(flags);
        if (configPath != null) {
            applyYaml(builder, readYaml(configPath));
        }
        applyEnv(builder, envLookup);
        applyFlags(builder, flags);
        return validate(builder.build());
    }

    /**
     * Loads a YAML file with the environment overlay, without command-line
     * flags.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RelayConfig load(Path configPath, Function<String, String> envLookup) {
        RelayConfig.Builder builder = RelayConfig.builder();
        applyYaml(builder, readYaml(configPath));
        applyEnv(builder, envLookup);
        return validate(builder.build());
    }

    // --- Command line ---

    /**
     * Splits arguments into flag → value. {@code --enable-https} without a
     * value means {@code true}.
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> flags = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }
            if (ENABLE_HTTPS.equals(name)) {
                flags.put(name, value != null ? parseBoolean(ENABLE_HTTPS, value) : "true");
            } else if (VALUE_FLAGS.contains(name)) {
                if (value == null) {
                    if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                        throw new ConfigLoadException(name + " requires a value");
                    }
                    value = args[++i];
                }
                flags.put(name, value);
            } else {
                throw new ConfigLoadException("Unknown argument: " + arg);
            }
        }
        return flags;
    }

    /**
     * Returns the YAML file to read: the {@code --config} value, or the
     * default file if it exists, or {@code null}.
     */
    static Path resolveConfigPath(Map<String, String> flags) {
        String explicit = flags.get(CONFIG);
        if (explicit != null) {
            Path path = Path.of(explicit);
            if (!Files.exists(path)) {
                throw new ConfigLoadException("Configuration file not found: " + path);
            }
            return path;
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.isRegularFile(fallback) ? fallback : null;
    }

    private static void applyFlags(RelayConfig.Builder builder, Map<String, String> flags) {
        flagInt(flags, HTTP_PORT, builder::httpPort);
        if (flags.containsKey(ENABLE_HTTPS)) {
            builder.tlsEnabled(Boolean.parseBoolean(flags.get(ENABLE_HTTPS)));
        }
        flagInt(flags, HTTPS_PORT, builder::httpsPort);
        flagString(flags, CRT_PATH, builder::crtPath);
        flagString(flags, KEY_PATH, builder::keyPath);
    }

    private static void flagInt(Map<String, String> flags, String flag, IntConsumer setter) {
        String value = flags.get(flag);
        if (value != null) {
            setter.accept(parseInt(flag, value));
        }
    }

    private static void flagString(Map<String, String> flags, String flag, Consumer<String> setter) {
        String value = flags.get(flag);
        if (value != null) {
            setter.accept(value);
        }
    }

    // --- YAML ---

    private static JsonNode readYaml(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            // an empty document parses to a missing node
            return root != null ? root : YAML_MAPPER.missingNode();
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    private static void applyYaml(RelayConfig.Builder builder, JsonNode root) {
        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("http-port")) builder.httpPort(yamlInt(server, "server.http-port", "http-port"));
        if (server.has("max-threads")) builder.maxThreads(yamlInt(server, "server.max-threads", "max-threads"));
        if (server.has("min-threads")) builder.minThreads(yamlInt(server, "server.min-threads", "min-threads"));
        if (server.has("idle-timeout-ms"))
            builder.idleTimeoutMs(yamlInt(server, "server.idle-timeout-ms", "idle-timeout-ms"));

        JsonNode relay = root.path("relay");
        if (relay.has("chunk-size")) builder.chunkSize(yamlInt(relay, "relay.chunk-size", "chunk-size"));
        if (relay.has("liveness-check-ms"))
            builder.livenessCheckMs(yamlInt(relay, "relay.liveness-check-ms", "liveness-check-ms"));

        JsonNode tls = root.path("tls");
        if (tls.has("enabled")) builder.tlsEnabled(tls.get("enabled").asBoolean());
        if (tls.has("https-port")) builder.httpsPort(yamlInt(tls, "tls.https-port", "https-port"));
        if (tls.has("crt-path")) builder.crtPath(tls.get("crt-path").asText());
        if (tls.has("key-path")) builder.keyPath(tls.get("key-path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static int yamlInt(JsonNode section, String key, String field) {
        JsonNode node = section.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigLoadException("Configuration key " + key + " must be an integer, got: " + node.asText());
        }
        return node.asInt();
    }

    // --- Environment ---

    private static void applyEnv(RelayConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "RELAY_HOST", builder::host);
        envInt(envLookup, "HTTP_PORT", builder::httpPort);
        envInt(envLookup, "SERVER_MAX_THREADS", builder::maxThreads);
        envInt(envLookup, "SERVER_MIN_THREADS", builder::minThreads);
        envInt(envLookup, "SERVER_IDLE_TIMEOUT_MS", builder::idleTimeoutMs);
        envInt(envLookup, "RELAY_CHUNK_SIZE", builder::chunkSize);
        envInt(envLookup, "RELAY_LIVENESS_CHECK_MS", builder::livenessCheckMs);
        envBool(envLookup, "HTTPS_ENABLED", builder::tlsEnabled);
        envInt(envLookup, "HTTPS_PORT", builder::httpsPort);
        envString(envLookup, "TLS_CRT_PATH", builder::crtPath);
        envString(envLookup, "TLS_KEY_PATH", builder::keyPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    /** An env var is set if it is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseInt(envVar, envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(parseBoolean(envVar, envLookup.apply(envVar).trim())));
        }
    }

    // --- Validation ---

    private static RelayConfig validate(RelayConfig config) {
        checkPort("HTTP port", config.httpPort());
        if (config.minThreads() < 1 || config.maxThreads() < config.minThreads()) {
            throw new ConfigLoadException("Invalid thread pool size: min=" + config.minThreads()
                    + ", max=" + config.maxThreads() + " (need 1 <= min <= max)");
        }
        if (config.idleTimeoutMs() < 1) {
            throw new ConfigLoadException("server.idle-timeout-ms must be positive: " + config.idleTimeoutMs());
        }
        if (config.chunkSize() < 1) {
            throw new ConfigLoadException("relay.chunk-size must be positive: " + config.chunkSize());
        }
        if (config.livenessCheckMs() < 1) {
            throw new ConfigLoadException(
                    "relay.liveness-check-ms must be positive: " + config.livenessCheckMs());
        }
        String format = config.loggingFormat().toLowerCase(Locale.ROOT);
        if (!"text".equals(format) && !"json".equals(format)) {
            throw new ConfigLoadException("logging.format must be text or json: " + config.loggingFormat());
        }
        TlsConfig tls = config.tls();
        if (tls.enabled()) {
            if (tls.httpsPort() == null || tls.crtPath() == null || tls.keyPath() == null) {
                throw new ConfigLoadException(
                        "HTTPS is enabled but https-port, crt-path and key-path are not all set"
                                + " (use --https-port, --crt-path and --key-path)");
            }
            checkPort("HTTPS port", tls.httpsPort());
        }
        return config;
    }

    private static void checkPort(String what, int port) {
        if (port < 0 || port > 65535) {
            throw new ConfigLoadException(what + " out of range: " + port);
        }
    }

    private static int parseInt(String source, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(source + " must be an integer, got: " + value, e);
        }
    }

    private static String parseBoolean(String source, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!"true".equals(normalized) && !"false".equals(normalized)) {
            throw new ConfigLoadException(source + " must be true or false, got: " + value);
        }
        return normalized;
    }
}
