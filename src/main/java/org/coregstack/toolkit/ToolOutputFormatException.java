package org.coregstack.toolkit;

/**
 * Captured toolkit output did not have the expected format.
 */
public class ToolOutputFormatException extends RuntimeException {

    public ToolOutputFormatException(String message) {
        super(message);
    }

    public ToolOutputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
