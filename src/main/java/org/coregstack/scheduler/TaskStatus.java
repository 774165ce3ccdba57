package org.coregstack.scheduler;

/**
 * Lifecycle of a task node. {@code SUCCEEDED} and {@code FAILED} are durable through completion markers.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
