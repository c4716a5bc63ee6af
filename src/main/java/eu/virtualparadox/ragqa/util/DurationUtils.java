package eu.virtualparadox.ragqa.util;

public final class DurationUtils {

    private DurationUtils() {
        // prevent instantiation
    }

    /**
     * @param nanos elapsed nanoseconds
     * @return milliseconds rounded to two decimals, never negative
     */
    public static double toMillis(final long nanos) {
        return Math.round(Math.max(0L, nanos) / 10_000.0) / 100.0;
    }
}
