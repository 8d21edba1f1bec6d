package io.simconvert.core.error;

/** Thrown when a document tree cannot be serialised. */
public final class DocumentWriteException extends ConverterException {

    private static final long serialVersionUID = 1L;

    public DocumentWriteException(String message, Throwable cause) {
        super(message, cause, Phase.WRITE);
    }
}
