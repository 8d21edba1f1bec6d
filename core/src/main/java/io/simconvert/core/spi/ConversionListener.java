package io.simconvert.core.spi;

/**
 * SPI for observing conversions.
 *
 * <p>
 * Hosts plug in implementations that feed metrics, audit logs or user prompts. All methods
 * receive immutable event records. Exceptions thrown by listeners are caught by the driver and
 * logged and do NOT affect the conversion.
 */
public interface ConversionListener {

    /**
     * Called before the first step runs.
     *
     * @param event contains the document version and the target version
     */
    void onConversionStarted(ConversionStartedEvent event);

    /**
     * Called after a step completed.
     *
     * @param event contains the step's source version, name and duration
     */
    void onStepApplied(StepAppliedEvent event);

    /**
     * Called after a step threw and was rolled back.
     *
     * @param event contains the step's source version, name and error detail
     */
    void onStepFailed(StepFailedEvent event);

    /**
     * Called once the root carries its final version.
     *
     * @param event contains from/to versions, step count and duration
     */
    void onConversionCompleted(ConversionCompletedEvent event);

    /**
     * Called when a document is newer than the engine supports.
     *
     * @param event contains the document version and the latest supported version
     */
    void onUnsupportedVersion(UnsupportedVersionEvent event);

    // --- Event records ---

    /** Event emitted when a conversion starts. */
    record ConversionStartedEvent(int fromVersion, int targetVersion) {}

    /** Event emitted when a step completes. */
    record StepAppliedEvent(int fromVersion, String stepName, long durationMs) {}

    /** Event emitted when a step fails. */
    record StepFailedEvent(int fromVersion, String stepName, String errorDetail) {}

    /** Event emitted when a conversion completes (or aborts). */
    record ConversionCompletedEvent(int fromVersion, int toVersion, int stepsApplied, long durationMs) {}

    /** Event emitted for a document newer than the engine. */
    record UnsupportedVersionEvent(int documentVersion, int latestVersion) {}
}
