package io.simconvert.standalone;

import io.simconvert.standalone.convert.ConversionReport;
import io.simconvert.standalone.convert.ConvertApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the command-line converter.
 *
 * <p>
 * Delegates to {@link ConvertApp#run(String[])}. Exits with status 1 if startup fails (bad
 * arguments or configuration) and with status 2 if any file could not be converted.
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
     *             {@code --config simdoc-convert.yaml simulations/})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        ConversionReport report;
        try {
            report = ConvertApp.run(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        if (report.hasFailures()) {
            LOG.error("Conversion failed for {} file(s): {}", report.failed(), report.failedFiles());
            System.exit(2);
        }
    }
}
