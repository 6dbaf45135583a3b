package com.phillippitts.streamscribe.util;

/**
 * Time and duration conversions used for inference timing and audio length reporting.
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
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts a sample count at the given rate to milliseconds of audio.
     *
     * @param samples    number of mono samples
     * @param sampleRate samples per second (must be positive)
     * @return audio duration in milliseconds (truncated)
     * @throws IllegalArgumentException if sampleRate is not positive
     */
    public static long samplesToMillis(long samples, int sampleRate) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        return samples * 1000L / sampleRate;
    }
}
