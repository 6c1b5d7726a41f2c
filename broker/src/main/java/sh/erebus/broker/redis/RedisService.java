package sh.erebus.broker.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.erebus.broker.config.BrokerConfig;

/**
 * Owns the node's Redis connection, shared by shard storage and the shard registry.
 * <p>
 * Lettuce multiplexes concurrent commands over the one connection.
 * </p>
 */
public class RedisService {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    @Getter
    private final RedisReactiveCommands<String, String> commands;

    public RedisService(BrokerConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
