package sh.erebus.broker.shard;

import reactor.core.publisher.Mono;
import sh.erebus.core.msg.ShardRpcCall;

/**
 * Invokes methods on channel shards, wherever they are hosted.
 */
public interface IShardRpcService {

    /**
     * Starts receiving calls addressed to the locations this node serves.
     *
     * @param dispatcher local delivery of received calls
     */
    Mono<Void> start(ShardRpcDispatcher dispatcher);

    /**
     * Sends {@code call} to its target shard. Completes once the call was handed to the shard
     * (local dispatch) or accepted by the transport (remote).
     */
    Mono<Void> invoke(ShardRpcCall call);

    Mono<Void> stop();
}
