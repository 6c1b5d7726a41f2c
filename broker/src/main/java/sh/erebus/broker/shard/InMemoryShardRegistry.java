package sh.erebus.broker.shard;

import reactor.core.publisher.Mono;
import sh.erebus.core.key.DistributedKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node shard directory for {@code STORAGE_MODE=memory}.
 */
public class InMemoryShardRegistry implements IShardRegistry {
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> registerChannelAndShard(String projectId, String channelKey, String locationHint) {
        return Mono.fromCallable(() -> {
            String shardKey = DistributedKey.appendLocationHint(channelKey, locationHint);
            members(projectId).add(channelKey);
            members(RedisShardRegistry.shardsKey(channelKey)).add(shardKey);
            return true;
        });
    }

    @Override
    public Mono<List<String>> getShards(String channelKey) {
        return Mono.fromCallable(() -> new ArrayList<>(members(RedisShardRegistry.shardsKey(channelKey))));
    }

    @Override
    public Mono<List<String>> getChannelsForProjectId(String projectId) {
        return Mono.fromCallable(() -> new ArrayList<>(members(projectId)));
    }

    private Set<String> members(String key) {
        return sets.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet());
    }
}
