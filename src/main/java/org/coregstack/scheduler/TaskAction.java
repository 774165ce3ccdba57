package org.coregstack.scheduler;

/**
 * The work of a task node. Any exception marks the node as failed.
 */
@FunctionalInterface
public interface TaskAction {

    TaskOutcome execute(TaskContext context) throws Exception;
}
