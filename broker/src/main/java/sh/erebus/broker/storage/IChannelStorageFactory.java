package sh.erebus.broker.storage;

/**
 * Resolves the storage of a shard. Repeated calls for the same shard key address the same data,
 * so an actor recreated after eviction sees everything its predecessor wrote.
 */
public interface IChannelStorageFactory {

    IChannelStorage forShard(String shardKey);

    default void close() {
    }
}
