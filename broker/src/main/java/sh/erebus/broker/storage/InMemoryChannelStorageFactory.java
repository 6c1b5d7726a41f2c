package sh.erebus.broker.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryChannelStorageFactory implements IChannelStorageFactory {
    private final Map<String, InMemoryChannelStorage> shards = new ConcurrentHashMap<>();

    @Override
    public IChannelStorage forShard(String shardKey) {
        return shards.computeIfAbsent(shardKey, key -> new InMemoryChannelStorage());
    }
}
