package io.accesslog.standalone;

import io.accesslog.standalone.server.ServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone access-logging server.
 *
 * <p>
 * Delegates to {@link ServerApp#start(String[])} for the full startup
 * sequence. On failure (unreadable config, malformed access log format,
 * port in use) logs the error and exits with a non-zero status code.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/config.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            ServerApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
