package com.phillippitts.parlcorpus.util;

import java.util.Locale;

/**
 * Utility methods for elapsed time and audio offset conversions.
 *
 * <p>Audio offsets are carried as centiseconds throughout the pipeline; the segment table
 * prints them as seconds with two decimals.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /**
     * Number of centiseconds in one second.
     */
    public static final long CENTIS_PER_SECOND = 100L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats a centisecond offset as seconds with two decimals, e.g. {@code 120 -> "1.20"}.
     */
    public static String centisToSeconds(long centis) {
        if (centis < 0) {
            throw new IllegalArgumentException("Offset must not be negative, got: " + centis);
        }
        return String.format(Locale.ROOT, "%d.%02d", centis / CENTIS_PER_SECOND, centis % CENTIS_PER_SECOND);
    }

    /**
     * Parses seconds such as {@code 1.2} or {@code 1.20} into centiseconds, rounding to the nearest.
     *
     * @throws NumberFormatException if the text is not a number
     */
    public static long secondsToCentis(String seconds) {
        double value = Double.parseDouble(seconds.trim());
        if (value < 0) {
            throw new NumberFormatException("Negative offset: " + seconds);
        }
        return Math.round(value * CENTIS_PER_SECOND);
    }
}
