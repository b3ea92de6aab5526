package com.phillippitts.photobatch.util;

import java.time.Duration;
import java.util.Locale;

/**
 * Time conversions used by pipeline timing and run summaries.
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
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Formats a duration as {@code H:MM:SS.mmm}, e.g. {@code 0:02:05.120}.
     *
     * @param duration non-negative duration
     * @return formatted duration
     */
    public static String formatElapsed(Duration duration) {
        Duration d = duration.isNegative() ? Duration.ZERO : duration;
        return String.format(Locale.ROOT, "%d:%02d:%02d.%03d",
                d.toHours(), d.toMinutesPart(), d.toSecondsPart(), d.toMillisPart());
    }
}
