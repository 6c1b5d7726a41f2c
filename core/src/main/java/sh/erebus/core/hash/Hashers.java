package sh.erebus.core.hash;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash functions for sequence seeding.
 */
public final class Hashers {
    private static final int FALLBACK_SEED = 0x2545F491;

    private Hashers() {
    }

    /**
     * Derives a positive, non-zero 32-bit seed from a string.
     * <p>
     * The same input always yields the same seed, so a generator seeded from a
     * topic name replays the same stream after a restart. Zero is excluded
     * because xorshift generators never leave the all-zero state.
     * </p>
     *
     * @param str Input string (e.g. a topic name)
     * @return seed in {@code [1, Integer.MAX_VALUE]}
     */
    public static int seedOf(String str) {
        int seed = Hashing.murmur3_32_fixed().hashString(str, StandardCharsets.UTF_8).asInt() & Integer.MAX_VALUE;
        return seed == 0 ? FALLBACK_SEED : seed;
    }
}
