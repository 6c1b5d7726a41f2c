package sh.erebus.broker.channel;

import lombok.Getter;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.broker.storage.IChannelStorage;
import sh.erebus.broker.ws.WebSocketConnection;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State shared by the services of one channel shard.
 * <p>
 * The connection table is the only in-memory state; everything else lives in
 * {@link #getStorage() storage} so the shard can be rebuilt after its actor is evicted.
 * </p>
 */
@Getter
public class ChannelContext {
    private final String shardKey;
    private final IChannelStorage storage;
    private final BrokerConfig config;
    private final Clock clock;
    /**
     * Serial scheduler of the owning actor.
     */
    private final Scheduler scheduler;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, WebSocketConnection> connections = new ConcurrentHashMap<>();

    public ChannelContext(String shardKey, IChannelStorage storage, BrokerConfig config,
                          Clock clock, Scheduler scheduler) {
        this.shardKey = shardKey;
        this.storage = storage;
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Re-queues the rest of the current pipeline behind whatever else the actor has pending.
     */
    public Mono<Void> yieldControl() {
        return Mono.just(Boolean.TRUE).publishOn(scheduler).then();
    }

    /**
     * Snapshot of the accepted connections.
     */
    public List<WebSocketConnection> getConnections() {
        return new ArrayList<>(connections.values());
    }

    public void addConnection(WebSocketConnection connection) {
        connections.put(connection.getId(), connection);
    }

    public boolean removeConnection(WebSocketConnection connection) {
        return connections.remove(connection.getId()) != null;
    }

    public int getConnectionCount() {
        return connections.size();
    }
}
