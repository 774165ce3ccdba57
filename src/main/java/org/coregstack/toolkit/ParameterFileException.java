package org.coregstack.toolkit;

/**
 * A parameter file is missing a key or holds a value that cannot be parsed.
 */
public class ParameterFileException extends RuntimeException {

    public ParameterFileException(String message) {
        super(message);
    }

    public ParameterFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
