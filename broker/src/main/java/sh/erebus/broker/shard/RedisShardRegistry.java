package sh.erebus.broker.shard;

import io.lettuce.core.api.reactive.RedisReactiveCommands;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import sh.erebus.core.key.DistributedKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Shard directory in Redis sets.
 * <p>
 * <b>Keys:</b>
 * <ul>
 *   <li>{@code {projectId}}: set of 4-segment channel keys</li>
 *   <li>{@code shards:{channelKey}}: set of 5-segment shard keys</li>
 * </ul>
 * </p>
 * <p>
 * Registration only writes the members that are missing. SADD is idempotent, so two nodes
 * racing on the same shard both end with the member present.
 * </p>
 */
@RequiredArgsConstructor
public class RedisShardRegistry implements IShardRegistry {
    private static final Logger log = LoggerFactory.getLogger(RedisShardRegistry.class);

    private final RedisReactiveCommands<String, String> commands;

    public static String shardsKey(String channelKey) {
        return "shards:" + channelKey;
    }

    @Override
    public Mono<Boolean> registerChannelAndShard(String projectId, String channelKey, String locationHint) {
        return Mono.defer(() -> {
            String shardKey = DistributedKey.appendLocationHint(channelKey, locationHint);
            String shardsKey = shardsKey(channelKey);

            return Mono.zip(commands.sismember(projectId, channelKey), commands.sismember(shardsKey, shardKey))
                .flatMap(present -> {
                    if (present.getT1() && present.getT2()) {
                        return Mono.just(true);
                    }
                    List<Mono<Long>> writes = new ArrayList<>();
                    if (!present.getT1()) {
                        writes.add(commands.sadd(projectId, channelKey));
                    }
                    if (!present.getT2()) {
                        writes.add(commands.sadd(shardsKey, shardKey));
                    }
                    return Mono.when(writes)
                        .doOnSuccess(v -> log.info("Registered shard {} (new channel: {})", shardKey, !present.getT1()))
                        .thenReturn(true);
                })
                .doOnError(err -> log.error("Failed to register shard {}", shardKey, err));
        });
    }

    @Override
    public Mono<List<String>> getShards(String channelKey) {
        return commands.smembers(shardsKey(channelKey)).collectList();
    }

    @Override
    public Mono<List<String>> getChannelsForProjectId(String projectId) {
        return commands.smembers(projectId).collectList();
    }
}
