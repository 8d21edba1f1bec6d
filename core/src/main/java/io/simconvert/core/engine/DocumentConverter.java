package io.simconvert.core.engine;

import io.simconvert.core.error.StepFailedException;
import io.simconvert.core.model.ConversionResult;
import io.simconvert.core.model.Document;
import io.simconvert.core.model.Node;
import io.simconvert.core.spi.ConversionListener;
import io.simconvert.core.step.RegisteredStep;
import io.simconvert.core.step.StepLibrary;
import io.simconvert.core.step.standard.StandardSteps;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Migration driver: brings a document tree from whatever schema version it carries up to the
 * latest one by applying the step for each version boundary in ascending order.
 *
 * <p>
 * The driver reads the version marker off the root (absent or malformed means 0):
 * <ul>
 * <li>newer than {@link #latestVersion()}: the document is left untouched and reported as
 * unsupported;
 * <li>equal to it: nothing to do;
 * <li>older: steps {@code v .. latest - 1} run in order, then the root is stamped with the
 * latest version.
 * </ul>
 *
 * <p>
 * No exception escapes step application. Before each step the root is snapshotted; a step that
 * throws is logged, the tree is restored from the snapshot, and the {@link StepFailurePolicy}
 * decides whether the chain continues.
 *
 * <p>
 * Thread-safe: holds only the immutable step library and configuration. Each call operates on a
 * tree owned by the caller; converting the same tree from two threads at once is not supported.
 */
public final class DocumentConverter {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentConverter.class);

    /** The schema version produced by the standard step catalog. */
    public static final int LATEST_VERSION = StandardSteps.LATEST_VERSION;

    private final StepLibrary library;
    private final ConverterConfig config;
    private final ConversionListener listener;

    /** Creates a driver over the standard catalog with the default configuration. */
    public DocumentConverter() {
        this(StandardSteps.library(), ConverterConfig.DEFAULT, null);
    }

    /**
     * Creates a driver over a custom catalog with the default configuration.
     *
     * @param library the step catalog
     */
    public DocumentConverter(StepLibrary library) {
        this(library, ConverterConfig.DEFAULT, null);
    }

    /**
     * Creates a driver with all options.
     *
     * @param library  the step catalog
     * @param config   driver configuration
     * @param listener optional listener for conversion events, may be null
     */
    public DocumentConverter(StepLibrary library, ConverterConfig config, ConversionListener listener) {
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = listener; // nullable
    }

    /** The version every conversion ends at. */
    public int latestVersion() {
        return library.latestVersion();
    }

    public ConverterConfig config() {
        return config;
    }

    /**
     * Converts a document root in place to the latest version.
     *
     * @param root the document root
     * @return {@code true} if the tree was changed, {@code false} if it was already current or
     *         is newer than this engine supports
     */
    public boolean convertToLatest(Node root) {
        return convert(root).changed();
    }

    /**
     * Converts a document root in place and describes what happened.
     *
     * @param root the document root
     * @return the conversion outcome; never null
     */
    public ConversionResult convert(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        Document document = new Document(root, config.versionAttribute());
        int fromVersion = document.version();
        int latest = library.latestVersion();

        if (!document.hasWellFormedVersion() && document.rawVersion() != null) {
            LOG.warn(
                    "Malformed version marker {}='{}' on <{}>, treating document as version 0",
                    config.versionAttribute(),
                    document.rawVersion(),
                    root.tag());
        }

        if (fromVersion > latest) {
            LOG.warn(
                    "conversion.unsupported document_version={} latest_version={} root={}",
                    fromVersion,
                    latest,
                    root.tag());
            notifyUnsupported(fromVersion, latest);
            return ConversionResult.unsupported(fromVersion);
        }
        if (fromVersion == latest) {
            LOG.debug("conversion.up_to_date version={} root={}", fromVersion, root.tag());
            return ConversionResult.upToDate(fromVersion);
        }

        long startNanos = System.nanoTime();
        notifyStarted(fromVersion, latest);

        List<Integer> applied = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        for (RegisteredStep step : library.chainFrom(fromVersion)) {
            if (applyIsolated(step, root)) {
                applied.add(step.fromVersion());
            } else {
                failed.add(step.fromVersion());
                if (config.stepFailurePolicy() == StepFailurePolicy.ABORT) {
                    break;
                }
            }
        }

        boolean aborted = config.stepFailurePolicy() == StepFailurePolicy.ABORT && !failed.isEmpty();
        int toVersion = aborted ? failed.get(0) : latest;
        if (toVersion != fromVersion) {
            document.stampVersion(toVersion);
        }
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;

        if (aborted) {
            LOG.warn(
                    "conversion.aborted from_version={} to_version={} failed_step={} duration_ms={}",
                    fromVersion,
                    toVersion,
                    failed.get(0),
                    durationMs);
        } else {
            LOG.info(
                    "conversion.completed from_version={} to_version={} steps={} failed_steps={} duration_ms={}",
                    fromVersion,
                    toVersion,
                    applied.size(),
                    failed.size(),
                    durationMs);
        }
        notifyCompleted(fromVersion, toVersion, applied.size(), durationMs);

        return aborted
                ? ConversionResult.aborted(fromVersion, toVersion, applied, failed)
                : ConversionResult.converted(fromVersion, toVersion, applied, failed);
    }

    /**
     * Runs one step against the root. On failure the root is restored to its state before the
     * step.
     *
     * @return {@code true} if the step completed
     */
    private boolean applyIsolated(RegisteredStep step, Node root) {
        Node snapshot = root.deepCopy();
        long stepStart = System.nanoTime();
        try {
            step.step().apply(root);
        } catch (RuntimeException e) {
            root.restoreFrom(snapshot);
            StepFailedException failure = new StepFailedException(step.fromVersion(), step.name(), e);
            LOG.warn("{}; step rolled back", failure.getMessage(), failure);
            notifyStepFailed(step, failure);
            return false;
        }
        long stepMs = (System.nanoTime() - stepStart) / 1_000_000;
        LOG.debug(
                "conversion.step from_version={} to_version={} step=\"{}\" duration_ms={}",
                step.fromVersion(),
                step.toVersion(),
                step.name(),
                stepMs);
        notifyStepApplied(step, stepMs);
        return true;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they MUST NOT affect conversion.

    private void notifyStarted(int fromVersion, int targetVersion) {
        if (listener == null) return;
        try {
            listener.onConversionStarted(new ConversionListener.ConversionStartedEvent(fromVersion, targetVersion));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onConversionStarted failed", e);
        }
    }

    private void notifyStepApplied(RegisteredStep step, long durationMs) {
        if (listener == null) return;
        try {
            listener.onStepApplied(
                    new ConversionListener.StepAppliedEvent(step.fromVersion(), step.name(), durationMs));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onStepApplied failed", e);
        }
    }

    private void notifyStepFailed(RegisteredStep step, StepFailedException failure) {
        if (listener == null) return;
        try {
            listener.onStepFailed(new ConversionListener.StepFailedEvent(
                    step.fromVersion(), step.name(), failure.getCause().getMessage()));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onStepFailed failed", e);
        }
    }

    private void notifyCompleted(int fromVersion, int toVersion, int stepsApplied, long durationMs) {
        if (listener == null) return;
        try {
            listener.onConversionCompleted(
                    new ConversionListener.ConversionCompletedEvent(fromVersion, toVersion, stepsApplied, durationMs));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onConversionCompleted failed", e);
        }
    }

    private void notifyUnsupported(int documentVersion, int latestVersion) {
        if (listener == null) return;
        try {
            listener.onUnsupportedVersion(new ConversionListener.UnsupportedVersionEvent(documentVersion, latestVersion));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onUnsupportedVersion failed", e);
        }
    }
}
