package sh.erebus.core.metrics;

/**
 * Micrometer metric names used across the broker.
 * <p>
 * <b>Naming convention:</b> {@code erebus.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Per-socket outcomes of a broadcast.
     * <p>
     * Tags: node_id, result (sent/skipped/duplicate/error)
     * </p>
     */
    public static final String BROADCAST_SOCKETS_TOTAL = "erebus.broadcast.sockets.total";

    /**
     * Counter: Sends skipped because the socket was above the high backpressure watermark.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String BROADCAST_HIGH_BACKPRESSURE_TOTAL = "erebus.broadcast.backpressure.high.total";

    /**
     * Counter: Times a broadcast yielded the actor between batches or under moderate backpressure.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String BROADCAST_YIELDS_TOTAL = "erebus.broadcast.yields.total";

    /**
     * Timer: Local fan-out duration of one publish.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String BROADCAST_LATENCY = "erebus.broadcast.latency";

    /**
     * Timer: Ingress to ack latency of an accepted publish.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String PUBLISH_LATENCY = "erebus.publish.latency";

    /**
     * Counter: Packets rejected or dropped.
     * <p>
     * Tags: node_id, reason (bad_request/unauthorized/forbidden/capacity/internal)
     * </p>
     */
    public static final String PACKETS_REJECTED_TOTAL = "erebus.packets.rejected.total";

    /**
     * Counter: Packets handled.
     * <p>
     * Tags: node_id, type (connect/subscribe/unsubscribe/publish)
     * </p>
     */
    public static final String PACKETS_TOTAL = "erebus.packets.total";

    /**
     * Gauge: Open WebSocket connections on this node.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String CONNECTIONS_ACTIVE = "erebus.connections.active";

    /**
     * Gauge: Channel actors currently resident on this node.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String ACTORS_ACTIVE = "erebus.actors.active";

    /**
     * Counter: Cross-shard RPC calls.
     * <p>
     * Tags: node_id, type (direct/kafka), result (ok/error)
     * </p>
     */
    public static final String SHARD_RPC_TOTAL = "erebus.shard.rpc.total";

    /**
     * Timer: Kafka record publish latency.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String KAFKA_PUBLISH_LATENCY = "erebus.kafka.publish.latency";

    /**
     * Counter: Usage events reported.
     * <p>
     * Tags: node_id, result (ok/error)
     * </p>
     */
    public static final String USAGE_EVENTS_TOTAL = "erebus.usage.events.total";

    /**
     * Counter: Network traffic inbound from WebSocket (bytes).
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "erebus.network.inbound.ws.bytes";

    /**
     * Counter: Network traffic outbound to WebSocket (bytes).
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "erebus.network.outbound.ws.bytes";
}
