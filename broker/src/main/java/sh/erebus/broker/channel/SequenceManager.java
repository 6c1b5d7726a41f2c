package sh.erebus.broker.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import sh.erebus.broker.storage.IChannelStorage;
import sh.erebus.broker.storage.StorageKeys;
import sh.erebus.core.hash.Hashers;
import sh.erebus.core.seq.SeededRandom;
import sh.erebus.core.seq.Ulid;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues per-topic ULID sequence numbers.
 * <p>
 * <b>Ordering guarantees:</b>
 * <ul>
 *   <li>Each value is strictly greater (as a string) than the previous one for the topic</li>
 *   <li>The embedded time never goes backwards, even if the wall clock does</li>
 *   <li>The cursor is persisted before the value is handed out</li>
 * </ul>
 * </p>
 * <p>
 * The random part comes from a PRNG seeded with the topic name, one instance per topic.
 * </p>
 */
public class SequenceManager {
    private static final Logger log = LoggerFactory.getLogger(SequenceManager.class);

    public static final String NO_SEQUENCE = "0";

    private final IChannelStorage storage;
    private final Clock clock;
    private final Map<String, SeededRandom> randoms = new ConcurrentHashMap<>();

    public SequenceManager(ChannelContext context) {
        this.storage = context.getStorage();
        this.clock = context.getClock();
    }

    /**
     * Mints and persists the next sequence for a topic.
     *
     * @return the new sequence; errors if it could not be persisted
     */
    public Mono<String> generateSequence(String projectId, String channel, String topic) {
        String key = StorageKeys.sequence(projectId, channel, topic);

        return storage.transaction(txn -> txn.get(key)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .map(last -> {
                    String next = nextAfter(topic, last.filter(Ulid::isValid).orElse(null));
                    txn.put(key, next);
                    return next;
                }))
            .doOnNext(seq -> log.debug("Generated seq {} for topic {}", seq, topic))
            .doOnError(err -> log.error("Failed to generate sequence for topic {}", topic, err));
    }

    String nextAfter(String topic, String last) {
        SeededRandom random = randoms.computeIfAbsent(topic, SeededRandom::forName);
        long now = clock.millis();

        synchronized (random) {
            if (last == null) {
                return Ulid.generate(now, random);
            }

            long lastTime = Ulid.decodeTime(last);
            long basis = Math.max(lastTime, now);
            if (basis != lastTime) {
                return Ulid.generate(basis, random);
            }
            try {
                return Ulid.increment(last);
            } catch (IllegalStateException exhausted) {
                // Random space of this millisecond is used up, move to the next one
                log.warn("Sequence space exhausted at {} for topic {}", lastTime, topic);
                return Ulid.generate(lastTime + 1, random);
            }
        }
    }

    /**
     * @return the last issued sequence, or {@value #NO_SEQUENCE} when none
     */
    public Mono<String> getCurrentSequence(String projectId, String channel, String topic) {
        return storage.get(StorageKeys.sequence(projectId, channel, topic))
            .defaultIfEmpty(NO_SEQUENCE);
    }

    /**
     * @throws IllegalArgumentException if {@code seq} is not a ULID
     */
    public long decodeSequenceTime(String seq) {
        return Ulid.decodeTime(seq);
    }

    public int compareSequences(String seq1, String seq2) {
        return Integer.signum(seq1.compareTo(seq2));
    }

    public boolean isSequenceAfter(String seq, String afterSeq) {
        return compareSequences(seq, afterSeq) > 0;
    }
}
