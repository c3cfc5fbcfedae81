package org.itinera.core.time;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Shared deterministic wall-clock helpers for trip scheduling.
 *
 * <p>Schedule arithmetic runs on minutes since midnight. Values are never wrapped at
 * 24:00; formatting past midnight yields hours of 24 and above so overflow stays
 * visible and ordered.</p>
 */
public final class TimeUtils {

    public static final int MINUTES_PER_HOUR = 60;
    public static final int MINUTES_PER_DAY = 1_440;

    private static final int MAX_CLOCK_HOUR = 23;
    private static final int MAX_CLOCK_MINUTE = 59;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses {@code HH:MM} into minutes since midnight.
     *
     * @param clock wall-clock text, for example {@code 09:30}.
     * @return minutes since midnight in range {@code [0, 1439]}.
     * @throws IllegalArgumentException when text is missing or malformed.
     */
    public static int parseClockMinutes(String clock) {
        if (clock == null || clock.isBlank()) {
            throw new IllegalArgumentException("clock time must be non-blank");
        }
        String trimmed = clock.trim();
        int separator = trimmed.indexOf(':');
        if (separator <= 0 || separator == trimmed.length() - 1 || trimmed.indexOf(':', separator + 1) >= 0) {
            throw new IllegalArgumentException("clock time must be HH:MM: " + clock);
        }
        final int hours;
        final int minutes;
        try {
            hours = Integer.parseInt(trimmed.substring(0, separator));
            minutes = Integer.parseInt(trimmed.substring(separator + 1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("clock time must be numeric HH:MM: " + clock, ex);
        }
        if (hours < 0 || hours > MAX_CLOCK_HOUR || minutes < 0 || minutes > MAX_CLOCK_MINUTE) {
            throw new IllegalArgumentException("clock time out of range: " + clock);
        }
        return hours * MINUTES_PER_HOUR + minutes;
    }

    /**
     * Formats minutes since midnight as zero-padded {@code HH:MM}.
     *
     * <p>No modulo is applied: {@code 1500} formats as {@code 25:00}.</p>
     *
     * @param minutesSinceMidnight non-negative minute count.
     * @return formatted clock text.
     */
    public static String formatClock(int minutesSinceMidnight) {
        if (minutesSinceMidnight < 0) {
            throw new IllegalArgumentException("minutes must be non-negative: " + minutesSinceMidnight);
        }
        int hours = minutesSinceMidnight / MINUTES_PER_HOUR;
        int minutes = minutesSinceMidnight % MINUTES_PER_HOUR;
        return String.format("%02d:%02d", hours, minutes);
    }

    /**
     * Shifts an ISO date by whole days.
     *
     * @param isoDate base date, {@code yyyy-MM-dd}.
     * @param days number of days to add (can be zero).
     * @return shifted ISO date.
     * @throws IllegalArgumentException when the base date is malformed.
     */
    public static String addDays(String isoDate, int days) {
        try {
            return LocalDate.parse(isoDate.trim()).plusDays(days).toString();
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("date must be ISO yyyy-MM-dd: " + isoDate, ex);
        }
    }
}
