package sh.erebus.core.util;

import java.time.Instant;

/**
 * Monotonic millisecond clock used for pipeline instrumentation.
 * <p>
 * Values have an arbitrary origin per JVM; only differences are meaningful.
 * </p>
 */
public final class MonoTime {
    private MonoTime() {
    }

    public static double nowMillis() {
        return System.nanoTime() / 1_000_000.0;
    }

    /**
     * Converts a monotonic timestamp taken on this JVM into wall-clock time.
     */
    public static Instant toWallClock(double monoMillis) {
        long elapsed = Math.round(nowMillis() - monoMillis);
        return Instant.ofEpochMilli(System.currentTimeMillis() - Math.max(0, elapsed));
    }
}
