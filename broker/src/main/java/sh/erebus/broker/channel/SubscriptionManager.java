package sh.erebus.broker.channel;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import sh.erebus.broker.storage.IChannelStorage;
import sh.erebus.broker.storage.ListOptions;
import sh.erebus.broker.storage.StorageKeys;
import sh.erebus.core.model.TopicGrant;
import sh.erebus.core.msg.PresencePacket;
import sh.erebus.core.util.JsonUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-topic subscriber lists of a channel shard.
 * <p>
 * Lists are stored as JSON arrays under {@link StorageKeys#subscribers}, keep
 * insertion order and never contain duplicates. Every mutation is a storage
 * transaction so concurrent subscribes on the same topic cannot lose entries.
 * </p>
 */
public class SubscriptionManager {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    public static final int MAX_SUBSCRIBERS_PER_TOPIC = 5120;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final IChannelStorage storage;
    private final PresenceListener presenceListener;

    public SubscriptionManager(ChannelContext context, PresenceListener presenceListener) {
        this.storage = context.getStorage();
        this.presenceListener = presenceListener;
    }

    /**
     * Adds {@code clientId} to the topic's subscribers. Subscribing twice is a no-op
     * for the list but still announces presence.
     *
     * @return errors with {@link CapacityExceededException} when the topic is full
     */
    public Mono<Void> subscribe(String projectId, String channel, String topic, String clientId) {
        String key = StorageKeys.subscribers(projectId, channel, topic);

        return storage.transaction(txn -> txn.get(key)
                .map(SubscriptionManager::decode)
                .defaultIfEmpty(new ArrayList<>())
                .flatMap(current -> {
                    if (current.size() >= MAX_SUBSCRIBERS_PER_TOPIC) {
                        return Mono.error(new CapacityExceededException(topic, MAX_SUBSCRIBERS_PER_TOPIC));
                    }
                    if (current.contains(clientId)) {
                        return Mono.just(current);
                    }
                    List<String> updated = new ArrayList<>(current);
                    updated.add(clientId);
                    txn.put(key, JsonUtils.writeValueAsString(updated));
                    return Mono.just(updated);
                }))
            .doOnNext(subscribers -> log.debug("Client {} subscribed to {} ({} subscribers)",
                clientId, topic, subscribers.size()))
            .flatMap(subscribers -> announce(clientId, topic, PresencePacket.Status.ONLINE, subscribers));
    }

    public Mono<Void> unsubscribe(String projectId, String channel, String topic, String clientId) {
        String key = StorageKeys.subscribers(projectId, channel, topic);

        return storage.transaction(txn -> txn.get(key)
                .map(SubscriptionManager::decode)
                .defaultIfEmpty(new ArrayList<>())
                .map(current -> {
                    List<String> updated = current.stream()
                        .filter(id -> !id.equals(clientId))
                        .collect(Collectors.toList());
                    if (updated.size() != current.size()) {
                        txn.put(key, JsonUtils.writeValueAsString(updated));
                    }
                    return updated;
                }))
            .doOnNext(subscribers -> log.debug("Client {} unsubscribed from {} ({} subscribers left)",
                clientId, topic, subscribers.size()))
            .flatMap(subscribers -> announce(clientId, topic, PresencePacket.Status.OFFLINE, subscribers));
    }

    /**
     * Removes a disconnecting client from every listed topic. Per-topic failures are logged
     * and do not stop the others.
     */
    public Mono<Void> bulkUnsubscribe(String clientId, String projectId, String channel, Collection<String> topics) {
        return Flux.fromIterable(topics)
            .distinct()
            .flatMap(topic -> unsubscribe(projectId, channel, topic, clientId)
                .onErrorResume(err -> {
                    log.error("Failed to unsubscribe {} from {} during cleanup", clientId, topic, err);
                    return Mono.empty();
                }))
            .then()
            .doOnSuccess(v -> log.debug("Bulk unsubscribe of {} from {} topics done", clientId, topics.size()));
    }

    /**
     * True when the client is subscribed to the topic itself or to the wildcard.
     */
    public Mono<Boolean> isSubscribed(String projectId, String channel, String topic, String clientId) {
        return Mono.zip(
                getSubscribers(projectId, channel, TopicGrant.WILDCARD),
                getSubscribers(projectId, channel, topic))
            .map(lists -> lists.getT1().contains(clientId) || lists.getT2().contains(clientId));
    }

    public Mono<List<String>> getSubscribers(String projectId, String channel, String topic) {
        return storage.get(StorageKeys.subscribers(projectId, channel, topic))
            .map(SubscriptionManager::decode)
            .defaultIfEmpty(List.of());
    }

    public Mono<Map<String, Integer>> getSubscriberCounts(String projectId, String channel, Collection<String> topics) {
        return Flux.fromIterable(topics)
            .concatMap(topic -> getSubscribers(projectId, channel, topic)
                .map(subscribers -> Map.entry(topic, subscribers.size())))
            .collect(LinkedHashMap::new, (counts, entry) -> counts.put(entry.getKey(), entry.getValue()));
    }

    /**
     * Topics with at least one subscriber, in key order.
     */
    public Mono<List<String>> getActiveTopics(String projectId, String channel) {
        String prefix = StorageKeys.subscribersPrefix(projectId, channel);
        return storage.list(ListOptions.builder().prefix(prefix).build())
            .filter(entry -> !decode(entry.getValue()).isEmpty())
            .map(entry -> entry.getKey().substring(prefix.length()))
            .collectList();
    }

    public Mono<Long> getTotalSubscriptionCount(String projectId, String channel) {
        return storage.list(ListOptions.builder().prefix(StorageKeys.subscribersPrefix(projectId, channel)).build())
            .map(entry -> (long) decode(entry.getValue()).size())
            .reduce(0L, Long::sum);
    }

    private Mono<Void> announce(String clientId, String topic, PresencePacket.Status status, List<String> subscribers) {
        return presenceListener.onPresenceChange(PresencePacket.of(clientId, topic, status), subscribers)
            .onErrorResume(err -> {
                log.error("Presence update failed for {} on {}", clientId, topic, err);
                return Mono.empty();
            });
    }

    private static List<String> decode(String json) {
        return JsonUtils.readValue(json, STRING_LIST);
    }
}
