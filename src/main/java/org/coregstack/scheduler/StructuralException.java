package org.coregstack.scheduler;

/**
 * The stack cannot be scheduled: an invalid task graph or an incomplete coregistration tree.
 * Aborts the whole run.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
