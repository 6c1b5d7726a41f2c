package sh.erebus.core.seq;

import sh.erebus.core.hash.Hashers;

/**
 * Deterministic xorshift32 generator.
 * <p>
 * Not thread-safe; callers that share an instance must serialize access.
 * </p>
 */
public final class SeededRandom {
    private static final double UINT32_MAX = 4294967295.0;

    private int state;

    public SeededRandom(int seed) {
        if (seed == 0) {
            throw new IllegalArgumentException("xorshift32 seed must be non-zero");
        }
        this.state = seed;
    }

    public static SeededRandom forName(String name) {
        return new SeededRandom(Hashers.seedOf(name));
    }

    /**
     * @return next value in {@code [0, 1]}
     */
    public double nextDouble() {
        state ^= state << 13;
        state ^= state >> 17;
        state ^= state << 5;
        return Integer.toUnsignedLong(state) / UINT32_MAX;
    }

    /**
     * @return next value in {@code [0, bound)}
     */
    public int nextInt(int bound) {
        int value = (int) Math.floor(nextDouble() * bound);
        return value == bound ? bound - 1 : value;
    }
}
