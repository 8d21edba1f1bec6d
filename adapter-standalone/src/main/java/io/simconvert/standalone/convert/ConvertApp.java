package io.simconvert.standalone.convert;

import io.simconvert.core.engine.DocumentConverter;
import io.simconvert.standalone.config.ConfigLoader;
import io.simconvert.standalone.config.StandaloneConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one command-line conversion.
 *
 * <p>
 * Sequence:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Convert every input file or directory</li>
 * <li>Log a summary and return the report</li>
 * </ol>
 *
 * <p>
 * This class is separate from {@link io.simconvert.standalone.StandaloneMain} so it can be tested
 * without going through {@code main()}.
 */
public final class ConvertApp {

    private static final Logger LOG = LoggerFactory.getLogger(ConvertApp.class);

    static final String USAGE = "Usage: simdoc-convert [--config <path>] <file|directory>...";

    private ConvertApp() {
        // utility class
    }

    /**
     * Runs a conversion using {@link System#getenv} for the environment overlay.
     *
     * @param args command-line arguments
     * @return the per-file report
     */
    public static ConversionReport run(String[] args) {
        return run(args, System::getenv);
    }

    /**
     * Runs a conversion.
     *
     * @param args      command-line arguments: an optional {@code --config <path>} and one or more
     *                  files or directories
     * @param envLookup environment variable lookup function
     * @return the per-file report
     * @throws IllegalArgumentException if no input is given
     * @throws io.simconvert.standalone.config.ConfigLoadException if the configuration is invalid
     */
    public static ConversionReport run(String[] args, Function<String, String> envLookup) {
        long startTime = System.nanoTime();

        StandaloneConfig config = ConfigLoader.loadForArgs(args, envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        List<Path> inputs = inputPaths(args);
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("No input files or directories given. " + USAGE);
        }
        LOG.info(
                "convert.started inputs={} latest_version={} backup={} dry_run={} include_glob={}"
                        + " step_failure_policy={}",
                inputs.size(),
                DocumentConverter.LATEST_VERSION,
                config.backup(),
                config.dryRun(),
                config.includeGlob(),
                config.stepFailurePolicy());

        ConversionReport report = new FileConverter(config).convertAll(inputs);

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "convert.summary files={} converted={} up_to_date={} unsupported={} failed={} dry_run={}"
                        + " duration_ms={}",
                report.total(),
                report.converted(),
                report.upToDate(),
                report.unsupported(),
                report.failed(),
                report.dryRun(),
                durationMs);
        return report;
    }

    /** Positional arguments, i.e. everything except {@code --config} and its value. */
    static List<Path> inputPaths(String[] args) {
        List<Path> inputs = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                i++;
            } else {
                inputs.add(Path.of(args[i]));
            }
        }
        return inputs;
    }
}
