package io.simconvert.core.error;

/**
 * Thrown when a step catalog is assembled inconsistently: a gap in the version chain, a
 * duplicate source version or a negative version.
 */
public final class StepLibraryException extends ConverterException {

    private static final long serialVersionUID = 1L;

    public StepLibraryException(String message) {
        super(message, Phase.LOAD);
    }
}
