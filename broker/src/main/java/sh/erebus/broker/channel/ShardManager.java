package sh.erebus.broker.channel;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import sh.erebus.broker.storage.IChannelStorage;
import sh.erebus.broker.storage.StorageKeys;
import sh.erebus.core.key.DistributedKey;
import sh.erebus.core.util.JsonUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps a shard's list of sibling shards (same channel, other locations) and its own location.
 * <p>
 * A shard is recognised as "self" by comparing the location segment of its 5-segment key
 * with the stored location hint.
 * </p>
 */
public class ShardManager {
    private static final Logger log = LoggerFactory.getLogger(ShardManager.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final IChannelStorage storage;

    public ShardManager(ChannelContext context) {
        this.storage = context.getStorage();
    }

    public Mono<List<String>> getAvailableShards() {
        return storage.get(StorageKeys.AVAILABLE_SHARDS)
            .map(json -> JsonUtils.readValue(json, STRING_LIST))
            .defaultIfEmpty(List.of());
    }

    /**
     * Replaces the sibling list with {@code shardKeys}, de-duplicated and without this shard.
     * Nothing is written when the result equals the stored set.
     */
    public Mono<Void> setShardsInLocalStorage(List<String> shardKeys) {
        return getLocationHint()
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(myLocation -> {
                List<String> unique = new LinkedHashSet<>(shardKeys).stream()
                    .filter(shardKey -> !isSelf(shardKey, myLocation.orElse(null)))
                    .collect(Collectors.toList());

                return getAvailableShards().flatMap(existing -> {
                    if (new HashSet<>(existing).equals(new HashSet<>(unique))) {
                        log.debug("Shard list unchanged ({} shards), skipping write", unique.size());
                        return Mono.empty();
                    }
                    return storage.put(StorageKeys.AVAILABLE_SHARDS, JsonUtils.writeValueAsString(unique))
                        .doOnSuccess(v -> log.info("Stored {} sibling shards (self location: {})",
                            unique.size(), myLocation.orElse("unset")));
                });
            });
    }

    public Mono<String> getLocationHint() {
        return storage.get(StorageKeys.LOCATION_HINT)
            .filter(hint -> !hint.isEmpty());
    }

    public Mono<Void> setLocationHint(String locationHint) {
        return storage.put(StorageKeys.LOCATION_HINT, locationHint);
    }

    public Mono<Void> addShard(String shardKey) {
        return getAvailableShards().flatMap(current -> {
            if (current.contains(shardKey)) {
                return Mono.empty();
            }
            List<String> updated = new ArrayList<>(current);
            updated.add(shardKey);
            return setShardsInLocalStorage(updated);
        });
    }

    public Mono<Void> removeShard(String shardKey) {
        return getAvailableShards().flatMap(current -> {
            List<String> updated = current.stream()
                .filter(shard -> !shard.equals(shardKey))
                .collect(Collectors.toList());
            if (updated.size() == current.size()) {
                return Mono.empty();
            }
            return setShardsInLocalStorage(updated);
        });
    }

    /**
     * Sibling shards to forward publishes to; never includes this shard.
     */
    public Mono<List<String>> getRemoteShards() {
        return Mono.zip(getAvailableShards(), getLocationHint().defaultIfEmpty(""))
            .map(tuple -> tuple.getT1().stream()
                .filter(shardKey -> !isSelf(shardKey, tuple.getT2()))
                .collect(Collectors.toList()));
    }

    public Mono<Boolean> shouldBroadcastToShards() {
        return getRemoteShards().map(remote -> !remote.isEmpty());
    }

    public Mono<ShardStatus> getShardStatus() {
        return Mono.zip(getLocationHint().defaultIfEmpty(""), getAvailableShards(), getRemoteShards())
            .map(tuple -> new ShardStatus(
                tuple.getT1().isEmpty() ? null : tuple.getT1(),
                tuple.getT2(),
                tuple.getT3(),
                tuple.getT2().size(),
                !tuple.getT3().isEmpty()));
    }

    public Mono<Void> clearShards() {
        return Mono.when(
            storage.delete(StorageKeys.AVAILABLE_SHARDS),
            storage.delete(StorageKeys.LOCATION_HINT));
    }

    private static boolean isSelf(String shardKey, String myLocation) {
        if (myLocation == null || myLocation.isEmpty()) {
            return false;
        }
        return Objects.equals(DistributedKey.locationOf(shardKey).orElse(null), myLocation);
    }
}
