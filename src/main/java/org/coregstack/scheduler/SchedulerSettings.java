package org.coregstack.scheduler;

import com.typesafe.config.Config;

/**
 * Settings of the task graph scheduler, read from {@code coregstack.scheduler}.
 *
 * @param workers         parallel task workers
 * @param reprocessFailed rerun nodes with a failure marker on resume
 */
public record SchedulerSettings(int workers, boolean reprocessFailed) {

    public SchedulerSettings {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
    }

    /**
     * Reads the block; {@code workers = 0} means one worker per available processor.
     */
    public static SchedulerSettings fromConfig(Config scheduler) {
        int workers = scheduler.getInt("workers");
        return new SchedulerSettings(
                workers > 0 ? workers : Runtime.getRuntime().availableProcessors(),
                scheduler.getBoolean("reprocess-failed"));
    }
}
