package sh.erebus.broker.shard;

import reactor.core.publisher.Mono;
import sh.erebus.core.msg.ShardRpcCall;

/**
 * Delivers a shard RPC to the actor of its target shard on this node.
 */
@FunctionalInterface
public interface ShardRpcDispatcher {
    Mono<Void> dispatch(ShardRpcCall call);
}
