package io.simconvert.core.error;

/**
 * Thrown when persisted bytes cannot be read into a document tree. Carries the file or resource
 * the bytes came from, when known.
 */
public final class DocumentParseException extends ConverterException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public DocumentParseException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    public DocumentParseException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier, or {@code null} for in-memory input. */
    public String source() {
        return source;
    }
}
