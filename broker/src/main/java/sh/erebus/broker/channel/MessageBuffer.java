package sh.erebus.broker.channel;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import sh.erebus.broker.storage.IChannelStorage;
import sh.erebus.broker.storage.ListOptions;
import sh.erebus.broker.storage.StorageKeys;
import sh.erebus.core.model.MessageBody;
import sh.erebus.core.model.MessageRecord;
import sh.erebus.core.util.JsonUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Time-limited message log and per-client read cursors of a channel shard.
 * <p>
 * <b>Storage layout:</b>
 * <ul>
 *   <li>{@code msg:{projectId}:{channel}:{topic}:{seq}} → {@code {body, exp}}; since seq is a ULID,
 *   key order is publish order</li>
 *   <li>{@code last_seq_seen:{projectId}:{channel}:{topic}:{clientId}} → seq, only ever moves forward</li>
 * </ul>
 * </p>
 * <p>
 * Expiry is lazy: expired records met while reading are deleted, and every write prunes
 * one bounded page of the topic.
 * </p>
 */
public class MessageBuffer {
    private static final Logger log = LoggerFactory.getLogger(MessageBuffer.class);

    public static final int DEFAULT_MESSAGE_LIMIT = 100;
    public static final int STORAGE_LIST_LIMIT = 1000;
    public static final int PRUNE_LIMIT_PER_ITERATION = 128;
    public static final String NO_SEQUENCE = "0";

    private final IChannelStorage storage;
    private final Clock clock;
    private final Duration ttl;

    public MessageBuffer(ChannelContext context) {
        this.storage = context.getStorage();
        this.clock = context.getClock();
        this.ttl = Duration.ofSeconds(context.getConfig().getMessageTtlSec());
    }

    /**
     * Stores the message with a fresh expiry, then prunes expired records of the topic.
     */
    public Mono<Void> bufferMessage(MessageBody message, String projectId, String channel, String topic, String seq) {
        String key = StorageKeys.message(projectId, channel, topic, seq);
        MessageRecord record = new MessageRecord(message, clock.millis() + ttl.toMillis());

        return storage.put(key, JsonUtils.writeValueAsString(record))
            .doOnSuccess(v -> log.debug("Buffered {} (expires {})", key, record.getExp()))
            .then(pruneExpiredMessages(projectId, channel, topic));
    }

    public Mono<List<MessageBody>> getMessagesAfter(String projectId, String channel, String topic, String afterSeq) {
        return getMessagesAfter(projectId, channel, topic, afterSeq, DEFAULT_MESSAGE_LIMIT);
    }

    /**
     * Messages with a sequence strictly greater than {@code afterSeq}, oldest first.
     * <p>
     * Only the first {@value #STORAGE_LIST_LIMIT} records of the topic are examined.
     * </p>
     */
    public Mono<List<MessageBody>> getMessagesAfter(String projectId, String channel, String topic,
                                                    String afterSeq, int limit) {
        String prefix = StorageKeys.messagePrefix(projectId, channel, topic);
        long now = clock.millis();

        return storage.list(ListOptions.prefix(prefix, STORAGE_LIST_LIMIT))
            .filter(entry -> afterSeq == null || entry.getKey().substring(prefix.length()).compareTo(afterSeq) > 0)
            .concatMap(entry -> liveBody(entry, now))
            .take(limit)
            .collectList()
            .doOnNext(messages -> log.debug("Found {} messages after {} on {}", messages.size(), afterSeq, topic));
    }

    /**
     * One page of a topic's buffered history.
     *
     * @param cursor exclusive sequence bound, or null to start at the oldest (forward)
     *               or newest (backward) message
     */
    public Mono<HistoryPage> getTopicHistory(String projectId, String channel, String topic,
                                             String cursor, int limit, HistoryDirection direction) {
        String prefix = StorageKeys.messagePrefix(projectId, channel, topic);
        long now = clock.millis();

        ListOptions.ListOptionsBuilder options = ListOptions.builder()
            .prefix(prefix)
            .limit(Math.max(STORAGE_LIST_LIMIT, limit + 1));
        if (direction == HistoryDirection.FORWARD) {
            options.startAfter(cursor == null ? null : prefix + cursor);
        } else {
            options.reverse(true).endBefore(cursor == null ? null : prefix + cursor);
        }

        return storage.list(options.build())
            .concatMap(entry -> liveBody(entry, now))
            .take(limit + 1L)
            .collectList()
            .map(bodies -> {
                if (bodies.size() <= limit) {
                    return new HistoryPage(bodies, null);
                }
                List<MessageBody> page = new ArrayList<>(bodies.subList(0, limit));
                return new HistoryPage(page, page.get(page.size() - 1).getSeq());
            });
    }

    /**
     * Advances the last-seen cursor of every listed client to {@code seq}, in one transaction.
     * Cursors already at or past {@code seq} are left alone.
     */
    public Mono<Void> updateLastSeenBulk(Collection<String> clientIds, String projectId, String channel,
                                         String topic, String seq) {
        if (clientIds.isEmpty()) {
            return Mono.empty();
        }

        return storage.transaction(txn -> Flux.fromIterable(clientIds)
                .distinct()
                .map(clientId -> StorageKeys.lastSeen(projectId, channel, topic, clientId))
                .concatMap(key -> txn.get(key)
                    .defaultIfEmpty(NO_SEQUENCE)
                    .doOnNext(current -> {
                        if (current.compareTo(seq) < 0) {
                            txn.put(key, seq);
                        }
                    }))
                .count())
            .doOnSuccess(count -> log.debug("Advanced last-seen of {} clients on {} to {}", count, topic, seq))
            .then();
    }

    public Mono<Void> updateLastSeenSingle(String projectId, String channel, String topic,
                                           String clientId, String seq) {
        return updateLastSeenBulk(List.of(clientId), projectId, channel, topic, seq);
    }

    /**
     * @return the client's cursor, or {@value #NO_SEQUENCE} when it has none
     */
    public Mono<String> getLastSeen(String projectId, String channel, String topic, String clientId) {
        return storage.get(StorageKeys.lastSeen(projectId, channel, topic, clientId))
            .defaultIfEmpty(NO_SEQUENCE);
    }

    /**
     * Deletes expired records among the oldest {@value #PRUNE_LIMIT_PER_ITERATION} of the topic.
     */
    public Mono<Void> pruneExpiredMessages(String projectId, String channel, String topic) {
        long now = clock.millis();

        return storage.list(ListOptions.prefix(StorageKeys.messagePrefix(projectId, channel, topic),
                PRUNE_LIMIT_PER_ITERATION))
            .filter(entry -> parseRecord(entry.getValue(), now)
                .map(record -> record.isExpiredAt(now))
                .orElse(false))
            .concatMap(entry -> storage.delete(entry.getKey()))
            .filter(Boolean::booleanValue)
            .count()
            .doOnNext(deleted -> {
                if (deleted > 0) {
                    log.debug("Pruned {} expired messages from {}", deleted, topic);
                }
            })
            .then();
    }

    /**
     * Number of stored records for the topic, expired ones included.
     */
    public Mono<Long> getMessageCount(String projectId, String channel, String topic) {
        return storage.list(ListOptions.builder().prefix(StorageKeys.messagePrefix(projectId, channel, topic)).build())
            .count();
    }

    private Mono<MessageBody> liveBody(Map.Entry<String, String> entry, long now) {
        Optional<MessageRecord> record = parseRecord(entry.getValue(), now);
        if (record.isEmpty()) {
            return Mono.empty();
        }
        if (record.get().isExpiredAt(now)) {
            return storage.delete(entry.getKey())
                .doOnNext(deleted -> log.debug("Deleted expired message {}", entry.getKey()))
                .then(Mono.<MessageBody>empty());
        }
        return Mono.just(record.get().getBody());
    }

    /**
     * Reads {@code {body, exp}} records as well as bare message bodies written before
     * expiry was tracked; the latter get a fresh expiry.
     */
    private Optional<MessageRecord> parseRecord(String value, long now) {
        try {
            JsonNode node = JsonUtils.mapper().readTree(value);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            if (node.hasNonNull("body") && node.path("exp").isNumber()) {
                return Optional.of(JsonUtils.mapper().treeToValue(node, MessageRecord.class));
            }
            if (node.hasNonNull("sentAt") || node.hasNonNull("topic")) {
                MessageBody body = JsonUtils.mapper().treeToValue(node, MessageBody.class);
                return Optional.of(new MessageRecord(body, now + ttl.toMillis()));
            }
            return Optional.empty();
        } catch (Exception e) {
            log.error("Skipping unreadable message record: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
