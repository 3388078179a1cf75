package colorbatch.utils;

public final class TimeUtils {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_SECOND;
    }

    // 3725.4 -> "01:02:05"
    public static String formatHMS(double seconds) {
        long s = (long) Math.max(0, seconds);
        return String.format("%02d:%02d:%02d", s / 3600, (s % 3600) / 60, s % 60);
    }

    public static double roundMillis(double seconds) {
        return Math.round(seconds * 1000.0) / 1000.0;
    }
}
