package io.simconvert.standalone.config;

/**
 * Thrown when the converter configuration cannot be loaded or holds an invalid value.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
