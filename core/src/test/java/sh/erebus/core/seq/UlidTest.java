package sh.erebus.core.seq;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UlidTest {

    private static final long TIME = 1_772_366_400_000L;

    @Test
    @DisplayName("Should encode time as 10 leading base32 characters")
    void testEncodeTime() {
        assertEquals("0000000000", Ulid.encodeTime(0));
        assertEquals("7ZZZZZZZZZ", Ulid.encodeTime(Ulid.MAX_TIME));
        assertThrows(IllegalArgumentException.class, () -> Ulid.encodeTime(-1));
        assertThrows(IllegalArgumentException.class, () -> Ulid.encodeTime(Ulid.MAX_TIME + 1));
    }

    @Test
    @DisplayName("Should recover the embedded timestamp")
    void testDecodeTime() {
        String ulid = Ulid.generate(TIME, new SeededRandom(42));

        assertEquals(Ulid.LENGTH, ulid.length());
        assertTrue(Ulid.isValid(ulid));
        assertEquals(TIME, Ulid.decodeTime(ulid));
    }

    @Test
    @DisplayName("Should sort chronologically as plain strings")
    void testLexicographicOrder() {
        SeededRandom random = new SeededRandom(7);
        String earlier = Ulid.generate(TIME, random);
        String later = Ulid.generate(TIME + 1, random);

        assertTrue(earlier.compareTo(later) < 0);
    }

    @Test
    @DisplayName("Should increment within the same millisecond, carrying over 'Z'")
    void testIncrement() {
        String base = Ulid.encodeTime(TIME) + "000000000000000Z";
        String next = Ulid.increment(base);

        assertEquals(Ulid.encodeTime(TIME) + "0000000000000010", next);
        assertEquals(TIME, Ulid.decodeTime(next));
        assertTrue(next.compareTo(base) > 0);
    }

    @Test
    @DisplayName("Should fail when the random part is exhausted")
    void testIncrementExhausted() {
        String max = Ulid.encodeTime(TIME) + "ZZZZZZZZZZZZZZZZ";

        assertThrows(IllegalStateException.class, () -> Ulid.increment(max));
    }

    @Test
    @DisplayName("Should reject malformed values")
    void testValidation() {
        assertFalse(Ulid.isValid(null));
        assertFalse(Ulid.isValid("0"));
        // I, L, O and U are not part of the Crockford alphabet
        assertFalse(Ulid.isValid(Ulid.encodeTime(TIME) + "IIIIIIIIIIIIIIII"));
        assertThrows(IllegalArgumentException.class, () -> Ulid.decodeTime("not-a-ulid"));
    }

    @Test
    @DisplayName("Should produce the same stream for the same topic seed")
    void testSeededDeterminism() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        SeededRandom a = SeededRandom.forName("chat");
        SeededRandom b = SeededRandom.forName("chat");

        for (int i = 0; i < 5; i++) {
            first.add(Ulid.generate(TIME, a));
            second.add(Ulid.generate(TIME, b));
        }

        assertEquals(first, second);
        assertNotEquals(first.get(0), first.get(1));
    }
}
