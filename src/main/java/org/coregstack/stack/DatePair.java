package org.coregstack.stack;

import java.util.Objects;

/**
 * An ordered (primary, secondary) pair of acquisition dates.
 * <p>
 * Written to pair list files as {@code primary,secondary}.
 *
 * @param primary   the first (reference side) date
 * @param secondary the second date
 */
public record DatePair(AcquisitionDate primary, AcquisitionDate secondary) {

    public DatePair {
        Objects.requireNonNull(primary, "primary");
        Objects.requireNonNull(secondary, "secondary");
        if (primary.equals(secondary)) {
            throw new IllegalArgumentException("A date pair needs two distinct dates: " + primary);
        }
    }

    /**
     * Parses a {@code primary,secondary} list file line.
     */
    public static DatePair parse(String line) {
        String[] parts = line.trim().split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid date pair line: '" + line + "'");
        }
        return new DatePair(AcquisitionDate.parse(parts[0]), AcquisitionDate.parse(parts[1]));
    }

    public long temporalBaselineDays() {
        return Math.abs(primary.daysUntil(secondary));
    }

    /** Identifier used in file and task names ({@code 20200101-20200113}). */
    public String id() {
        return primary + "-" + secondary;
    }

    @Override
    public String toString() {
        return primary + "," + secondary;
    }
}
