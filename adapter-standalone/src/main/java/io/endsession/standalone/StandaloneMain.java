package io.endsession.standalone;

import io.endsession.standalone.http.ServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone end-session server.
 *
 * <p>
 * Delegates to {@link ServerApp#start(String[])} and stops the server on JVM shutdown. On
 * startup failure, logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/config.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            ServerApp server = ServerApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "endsession-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
