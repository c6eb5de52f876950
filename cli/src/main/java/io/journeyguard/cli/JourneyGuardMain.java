package io.journeyguard.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code journey-guard} command line.
 *
 * <p>
 * Delegates to {@link CliApp#run(String[])} and exits with its status code. Unexpected failures
 * are logged and exit with {@link CliApp#EXIT_FAILURE}.
 */
public final class JourneyGuardMain {

    private static final Logger LOG = LoggerFactory.getLogger(JourneyGuardMain.class);

    private JourneyGuardMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code validate journey.json --config journey-guard.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new CliApp(System.out, System.err, System::getenv).run(args);
        } catch (Exception e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            status = CliApp.EXIT_FAILURE;
        }
        System.exit(status);
    }
}
