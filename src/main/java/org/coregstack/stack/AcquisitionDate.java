package org.coregstack.stack;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Calendar date identifying one scene of a stack.
 * <p>
 * Equality and ordering are by date. The textual form is the compact {@code yyyyMMdd}
 * used in list files, marker names and scene directories.
 *
 * @param date the acquisition date
 */
public record AcquisitionDate(LocalDate date) implements Comparable<AcquisitionDate> {

    /** Compact scene date format ({@code 20200115}). */
    public static final DateTimeFormatter SCENE_DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    public AcquisitionDate {
        Objects.requireNonNull(date, "date");
    }

    /**
     * Parses a compact ({@code yyyyMMdd}) or ISO ({@code yyyy-MM-dd}) scene date.
     *
     * @param text the date text, surrounding whitespace is ignored
     * @return the parsed date
     * @throws IllegalArgumentException if the text is not a valid date
     */
    public static AcquisitionDate parse(String text) {
        String trimmed = text.trim();
        try {
            if (trimmed.length() == 10 && trimmed.charAt(4) == '-') {
                return new AcquisitionDate(LocalDate.parse(trimmed));
            }
            return new AcquisitionDate(LocalDate.parse(trimmed, SCENE_DATE_FORMAT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid acquisition date: '" + text + "'", e);
        }
    }

    public static AcquisitionDate of(int year, int month, int day) {
        return new AcquisitionDate(LocalDate.of(year, month, day));
    }

    /**
     * Signed number of days from this date to {@code other} (positive when other is later).
     */
    public long daysUntil(AcquisitionDate other) {
        return ChronoUnit.DAYS.between(date, other.date);
    }

    public AcquisitionDate plusDays(long days) {
        return new AcquisitionDate(date.plusDays(days));
    }

    public boolean isBefore(AcquisitionDate other) {
        return date.isBefore(other.date);
    }

    public boolean isAfter(AcquisitionDate other) {
        return date.isAfter(other.date);
    }

    @Override
    public int compareTo(AcquisitionDate other) {
        return date.compareTo(other.date);
    }

    @Override
    public String toString() {
        return date.format(SCENE_DATE_FORMAT);
    }
}
