package sh.erebus.core.msg;

/**
 * Kafka topic names.
 */
public final class Topics {
    private Topics() {
    }

    /**
     * Usage accounting envelopes. Produced by every broker node, consumed by the webhook forwarder.
     */
    public static final String USAGE = "erebus.usage";

    /**
     * Prefix for per-location shard RPC topics.
     * <p>
     * Topic naming convention: erebus.shard.rpc.{location}
     * Example: erebus.shard.rpc.wnam
     * </p>
     * <p>
     * The node serving a location is the only consumer of that location's topic,
     * so an RPC is read exactly by the node that owns the target shard.
     * </p>
     */
    public static final String SHARD_RPC_PREFIX = "erebus.shard.rpc.";

    /**
     * Generates the shard RPC topic for a location.
     *
     * @param location Location hint (last segment of a shard key)
     * @return Topic name: erebus.shard.rpc.{location}
     */
    public static String shardRpcTopicFor(String location) {
        return SHARD_RPC_PREFIX + location;
    }

}
