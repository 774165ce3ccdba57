package org.coregstack.tree;

import com.typesafe.config.Config;

/**
 * Settings of the coregistration tree, read from {@code coregstack.tree}.
 *
 * @param thresholdDays    maximum temporal distance between a date and its local reference
 * @param includeClosest   fall back to the closest date of a side when none lies within the threshold
 * @param failOnUnreachable treat dates the tree cannot reach as a structural failure
 */
public record TreeSettings(int thresholdDays, boolean includeClosest, boolean failOnUnreachable) {

    public static final int DEFAULT_THRESHOLD_DAYS = 63;

    public TreeSettings {
        if (thresholdDays <= 0) {
            throw new IllegalArgumentException("threshold-days must be positive, got " + thresholdDays);
        }
    }

    public static TreeSettings defaults() {
        return new TreeSettings(DEFAULT_THRESHOLD_DAYS, true, true);
    }

    public static TreeSettings fromConfig(Config tree) {
        return new TreeSettings(
                tree.getInt("threshold-days"),
                tree.getBoolean("include-closest"),
                tree.getBoolean("fail-on-unreachable"));
    }
}
