package com.phillippitts.saleshud.util;

/**
 * Conversions for timings taken with {@link System#nanoTime()}.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed nanoseconds since startNanos
     */
    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }
}
