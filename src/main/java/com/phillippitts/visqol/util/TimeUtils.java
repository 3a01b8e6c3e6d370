package com.phillippitts.visqol.util;

/**
 * Conversions for {@link System#nanoTime()} based timing.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * @return {@code nanos} in whole milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * <pre>
     * long start = System.nanoTime();
     * // ... measure ...
     * long elapsedMs = TimeUtils.elapsedMillis(start);
     * </pre>
     *
     * @param startNanos value previously returned by {@link System#nanoTime()}
     * @return whole milliseconds elapsed since {@code startNanos}
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }
}
