package com.phillippitts.champ.util;

import java.time.Duration;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Provides convenient methods for converting between nanoseconds and milliseconds,
 * commonly used for performance timing with {@link System#nanoTime()}.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to fractional milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds
     */
    public static double nanosToMillis(long nanos) {
        return nanos / (double) NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed fractional milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static double elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Converts fractional seconds (as used by multiplicative backoff factors) to a Duration.
     *
     * @param seconds seconds, may be fractional; negative values clamp to zero
     * @return duration with millisecond precision
     */
    public static Duration ofSeconds(double seconds) {
        return Duration.ofMillis(Math.max(0L, Math.round(seconds * 1000.0)));
    }
}
