package sh.erebus.broker.shard;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import sh.erebus.core.msg.ShardRpcCall;

import java.util.List;

/**
 * Keeps every shard of a channel informed about its siblings.
 * <p>
 * Runs on each WebSocket connect: registers the connecting shard, reads the channel's full
 * shard list and pushes it to every shard (including the new one). The push is best effort:
 * a shard that misses it keeps its previous list until the next connect anywhere on the channel.
 * </p>
 */
@RequiredArgsConstructor
public class ShardMembershipService {
    private static final Logger log = LoggerFactory.getLogger(ShardMembershipService.class);

    private final IShardRegistry registry;
    private final IShardRpcService shardRpcService;

    /**
     * Never errors.
     *
     * @param channelKey 4-segment channel key
     */
    public Mono<Void> onShardConnected(String projectId, String channelKey, String locationHint) {
        return registry.registerChannelAndShard(projectId, channelKey, locationHint)
            .flatMap(registered -> {
                if (!registered) {
                    log.error("Shard {}@{} was not registered, skipping shard list push", channelKey, locationHint);
                    return Mono.<List<String>>empty();
                }
                return registry.getShards(channelKey);
            })
            .flatMapMany(shards -> {
                log.debug("Pushing {} shards of {} to every shard", shards.size(), channelKey);
                return Flux.fromIterable(shards)
                    .flatMap(shard -> shardRpcService.invoke(new ShardRpcCall.SetShards(shard, shards))
                        .onErrorResume(err -> {
                            log.warn("Failed to update shard list of {}: {}", shard, err.getMessage());
                            return Mono.empty();
                        }));
            })
            .then()
            .onErrorResume(err -> {
                log.error("Shard membership update for {} failed", channelKey, err);
                return Mono.empty();
            });
    }
}
