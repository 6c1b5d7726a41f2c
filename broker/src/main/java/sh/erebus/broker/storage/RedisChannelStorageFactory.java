package sh.erebus.broker.storage;

import io.lettuce.core.api.reactive.RedisReactiveCommands;
import lombok.RequiredArgsConstructor;

/**
 * Hands out per-shard views over one shared Redis connection.
 */
@RequiredArgsConstructor
public class RedisChannelStorageFactory implements IChannelStorageFactory {
    private final RedisReactiveCommands<String, String> commands;

    @Override
    public IChannelStorage forShard(String shardKey) {
        return new RedisChannelStorage(commands, shardKey);
    }
}
