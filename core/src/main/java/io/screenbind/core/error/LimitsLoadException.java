package io.screenbind.core.error;

/**
 * Thrown when engine limits cannot be loaded: missing file, invalid YAML, or an override that is
 * not a positive integer.
 */
public class LimitsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LimitsLoadException(String message) {
        super(message);
    }

    public LimitsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
