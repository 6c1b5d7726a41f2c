package sh.erebus.broker.channel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;
import sh.erebus.broker.storage.InMemoryChannelStorage;
import sh.erebus.broker.storage.StorageKeys;
import sh.erebus.broker.support.MutableClock;
import sh.erebus.broker.support.TestFixtures;
import sh.erebus.core.seq.Ulid;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static sh.erebus.broker.support.TestFixtures.CHANNEL;
import static sh.erebus.broker.support.TestFixtures.PROJECT;

class SequenceManagerTest {

    private MutableClock clock;
    private InMemoryChannelStorage storage;
    private SequenceManager sequenceManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.NOW);
        storage = new InMemoryChannelStorage();
        sequenceManager = new SequenceManager(TestFixtures.context(storage, clock));
    }

    @Test
    @DisplayName("Should issue strictly increasing sequences within one millisecond")
    void testMonotonicSameMillisecond() {
        List<String> seqs = Flux.range(0, 50)
                .concatMap(i -> sequenceManager.generateSequence(PROJECT, CHANNEL, "chat"))
                .collectList()
                .block();

        for (int i = 1; i < seqs.size(); i++) {
            assertTrue(seqs.get(i).compareTo(seqs.get(i - 1)) > 0, "not increasing at " + i);
            assertEquals(TestFixtures.NOW.toEpochMilli(), Ulid.decodeTime(seqs.get(i)));
        }
    }

    @Test
    @DisplayName("Should never move the embedded time backwards when the clock does")
    void testClockGoingBackwards() {
        String first = sequenceManager.generateSequence(PROJECT, CHANNEL, "chat").block();

        clock.advance(Duration.ofSeconds(-5));
        String second = sequenceManager.generateSequence(PROJECT, CHANNEL, "chat").block();

        assertTrue(second.compareTo(first) > 0);
        assertEquals(Ulid.decodeTime(first), Ulid.decodeTime(second));
    }

    @Test
    @DisplayName("Should move to the new millisecond once the clock advances")
    void testClockAdvancing() {
        String first = sequenceManager.generateSequence(PROJECT, CHANNEL, "chat").block();

        clock.advance(Duration.ofMillis(3));
        String second = sequenceManager.generateSequence(PROJECT, CHANNEL, "chat").block();

        assertEquals(Ulid.decodeTime(first) + 3, Ulid.decodeTime(second));
    }

    @Test
    @DisplayName("Should persist the cursor and continue after it")
    void testPersistsCursor() {
        String issued = sequenceManager.generateSequence(PROJECT, CHANNEL, "chat").block();

        StepVerifier.create(sequenceManager.getCurrentSequence(PROJECT, CHANNEL, "chat"))
                .expectNext(issued)
                .verifyComplete();

        // A fresh manager on the same storage picks up where the old one stopped
        SequenceManager restarted = new SequenceManager(TestFixtures.context(storage, clock));
        String next = restarted.generateSequence(PROJECT, CHANNEL, "chat").block();
        assertTrue(next.compareTo(issued) > 0);
    }

    @Test
    @DisplayName("Should report the sentinel for topics without a sequence and ignore corrupt cursors")
    void testMissingAndCorruptCursor() {
        StepVerifier.create(sequenceManager.getCurrentSequence(PROJECT, CHANNEL, "fresh"))
                .expectNext(SequenceManager.NO_SEQUENCE)
                .verifyComplete();

        storage.put(StorageKeys.sequence(PROJECT, CHANNEL, "broken"), "garbage").block();
        String seq = sequenceManager.generateSequence(PROJECT, CHANNEL, "broken").block();
        assertTrue(Ulid.isValid(seq));
    }

    @Test
    @DisplayName("Should roll into the next millisecond when the random space runs out")
    void testExhaustedRandomSpace() {
        String max = Ulid.encodeTime(TestFixtures.NOW.toEpochMilli()) + "ZZZZZZZZZZZZZZZZ";

        String next = sequenceManager.nextAfter("chat", max);

        assertEquals(TestFixtures.NOW.toEpochMilli() + 1, Ulid.decodeTime(next));
        assertTrue(sequenceManager.isSequenceAfter(next, max));
    }

    @Test
    @DisplayName("Should read the issue time back out of a sequence and order sequences")
    void testDecodeAndCompare() {
        String first = sequenceManager.generateSequence(PROJECT, CHANNEL, "chat").block();
        clock.advance(Duration.ofMillis(250));
        String second = sequenceManager.generateSequence(PROJECT, CHANNEL, "chat").block();

        assertEquals(TestFixtures.NOW.toEpochMilli(), sequenceManager.decodeSequenceTime(first));
        assertEquals(TestFixtures.NOW.toEpochMilli() + 250, sequenceManager.decodeSequenceTime(second));
        assertEquals(-1, sequenceManager.compareSequences(first, second));
        assertEquals(0, sequenceManager.compareSequences(second, second));
        assertThrows(IllegalArgumentException.class, () -> sequenceManager.decodeSequenceTime("not-a-ulid"));
    }
}
