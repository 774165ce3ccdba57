package org.coregstack.scheduler;

import java.util.List;

/**
 * Result of a task action that completed. Warnings mark the product as degraded.
 *
 * @param warnings accuracy warnings attached to the product
 */
public record TaskOutcome(List<String> warnings) {

    private static final TaskOutcome SUCCESS = new TaskOutcome(List.of());

    public TaskOutcome {
        warnings = List.copyOf(warnings);
    }

    public static TaskOutcome success() {
        return SUCCESS;
    }

    public static TaskOutcome degraded(List<String> warnings) {
        return new TaskOutcome(warnings);
    }

    public boolean isDegraded() {
        return !warnings.isEmpty();
    }
}
