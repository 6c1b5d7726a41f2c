package sh.erebus.core.seq;

import java.util.function.IntUnaryOperator;

/**
 * Universally Unique Lexicographically Sortable Identifier codec.
 * <p>
 * <b>Layout:</b> 26 Crockford base32 characters
 * <ul>
 *   <li>10 characters: 48-bit millisecond timestamp, most significant first</li>
 *   <li>16 characters: 80 bits of randomness</li>
 * </ul>
 * </p>
 * <p>
 * Because the timestamp leads and the alphabet is in ASCII order, comparing two
 * ULIDs as strings compares them chronologically. Values minted within the same
 * millisecond are kept ordered by {@link #increment(String)}.
 * </p>
 */
public final class Ulid {
    public static final int LENGTH = 26;
    public static final long MAX_TIME = (1L << 48) - 1;

    static final String ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

    private static final int ENCODING_LENGTH = ENCODING.length();
    private static final int TIME_LENGTH = 10;
    private static final int RANDOM_LENGTH = 16;

    private Ulid() {
    }

    /**
     * Mints a ULID for the given time using {@code random} for the random part.
     *
     * @param timeMillis epoch millis, {@code 0..2^48-1}
     * @param random     yields an index in {@code [0, bound)} for a given bound
     */
    public static String generate(long timeMillis, IntUnaryOperator random) {
        StringBuilder sb = new StringBuilder(LENGTH);
        sb.append(encodeTime(timeMillis));
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(ENCODING.charAt(random.applyAsInt(ENCODING_LENGTH)));
        }
        return sb.toString();
    }

    public static String generate(long timeMillis, SeededRandom random) {
        return generate(timeMillis, random::nextInt);
    }

    public static String encodeTime(long timeMillis) {
        if (timeMillis < 0 || timeMillis > MAX_TIME) {
            throw new IllegalArgumentException("ULID time out of range: " + timeMillis);
        }
        char[] chars = new char[TIME_LENGTH];
        long remaining = timeMillis;
        for (int i = TIME_LENGTH - 1; i >= 0; i--) {
            chars[i] = ENCODING.charAt((int) (remaining % ENCODING_LENGTH));
            remaining /= ENCODING_LENGTH;
        }
        return new String(chars);
    }

    /**
     * Extracts the embedded timestamp.
     *
     * @throws IllegalArgumentException if {@code ulid} is not a well-formed ULID
     */
    public static long decodeTime(String ulid) {
        requireValid(ulid);
        long time = 0;
        for (int i = 0; i < TIME_LENGTH; i++) {
            time = time * ENCODING_LENGTH + ENCODING.indexOf(ulid.charAt(i));
        }
        if (time > MAX_TIME) {
            throw new IllegalArgumentException("ULID time component overflows 48 bits: " + ulid);
        }
        return time;
    }

    /**
     * Returns the next ULID after {@code ulid} with the same timestamp.
     *
     * @throws IllegalStateException if the random part is already at its maximum
     */
    public static String increment(String ulid) {
        requireValid(ulid);
        char[] chars = ulid.toCharArray();
        for (int i = LENGTH - 1; i >= TIME_LENGTH; i--) {
            int index = ENCODING.indexOf(chars[i]);
            if (index < ENCODING_LENGTH - 1) {
                chars[i] = ENCODING.charAt(index + 1);
                return new String(chars);
            }
            chars[i] = ENCODING.charAt(0);
        }
        throw new IllegalStateException("ULID random component exhausted for " + ulid);
    }

    public static boolean isValid(String ulid) {
        if (ulid == null || ulid.length() != LENGTH) {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            if (ENCODING.indexOf(ulid.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    private static void requireValid(String ulid) {
        if (!isValid(ulid)) {
            throw new IllegalArgumentException("Malformed ULID: " + ulid);
        }
    }
}
