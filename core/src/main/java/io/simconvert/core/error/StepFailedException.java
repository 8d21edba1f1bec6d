package io.simconvert.core.error;

/**
 * Records a conversion step that threw. The driver builds one for logging and listeners after
 * rolling the step back; it never propagates out of the driver.
 */
public final class StepFailedException extends ConverterException {

    private static final long serialVersionUID = 1L;

    private final int fromVersion;
    private final String stepName;

    public StepFailedException(int fromVersion, String stepName, Throwable cause) {
        super(
                String.format(
                        "Step %d->%d (%s) failed: %s", fromVersion, fromVersion + 1, stepName, cause.getMessage()),
                cause,
                Phase.CONVERSION);
        this.fromVersion = fromVersion;
        this.stepName = stepName;
    }

    /** Source version of the failed step. */
    public int fromVersion() {
        return fromVersion;
    }

    public String stepName() {
        return stepName;
    }
}
