package org.coregstack.coreg;

/**
 * A coregistration step failed.
 */
public class CoregistrationException extends RuntimeException {

    public CoregistrationException(String message) {
        super(message);
    }

    public CoregistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
