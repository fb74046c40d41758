package io.pipingrelay.server;

import io.pipingrelay.server.config.ConfigLoader;
import io.pipingrelay.server.config.RelayConfig;
import io.pipingrelay.server.http.LogbackConfigurator;
import io.pipingrelay.server.http.RelayApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the relay server.
 *
 * <p>
 * Loads configuration from the command line, environment and optional YAML
 * file, applies the logging settings, then hands over to
 * {@link RelayApp#start(RelayConfig)}. On failure, logs the error and exits
 * with status {@code 1}.
 */
public final class RelayMain {

    private static final Logger LOG = LoggerFactory.getLogger(RelayMain.class);

    private RelayMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line flags (e.g. {@code --http-port 8080})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            RelayConfig config = ConfigLoader.load(args);
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            RelayApp app = RelayApp.start(config);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "relay-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
