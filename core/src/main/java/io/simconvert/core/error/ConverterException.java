package io.simconvert.core.error;

/**
 * Abstract base for all simdoc-convert exceptions. Never thrown directly; use the concrete
 * subclasses.
 */
public abstract class ConverterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        CONVERSION,
        WRITE
    }

    private final Phase phase;

    protected ConverterException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ConverterException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
