package sh.erebus.broker.shard;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Cluster-wide directory of channels and their regional shards.
 */
public interface IShardRegistry {

    /**
     * Records {@code channelKey} under its project and the shard at {@code locationHint} under the channel.
     *
     * @param channelKey 4-segment channel key
     * @return true when both entries exist afterwards
     */
    Mono<Boolean> registerChannelAndShard(String projectId, String channelKey, String locationHint);

    /**
     * @param channelKey 4-segment channel key
     * @return 5-segment keys of every registered shard of the channel
     */
    Mono<List<String>> getShards(String channelKey);

    Mono<List<String>> getChannelsForProjectId(String projectId);
}
