package sh.erebus.broker.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import sh.erebus.broker.channel.BroadcastStats;
import sh.erebus.core.metrics.MetricsNames;
import sh.erebus.core.metrics.MetricsTags;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics for a broker node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter broadcastSent;
    private final Counter broadcastSkipped;
    private final Counter broadcastDuplicate;
    private final Counter broadcastError;
    private final Counter broadcastHighBackpressure;
    private final Counter broadcastYields;

    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    private final Timer broadcastLatency;
    private final Timer publishLatency;
    private final Timer kafkaPublishLatency;

    private final AtomicInteger activeConnections = new AtomicInteger();

    // Tagged counters created on first use
    private final Map<String, Counter> dynamicCounters = new ConcurrentHashMap<>();

    public MetricsService(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.nodeId = nodeId;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        broadcastSent = broadcastCounter("sent", "Messages written to a local socket");
        broadcastSkipped = broadcastCounter("skipped", "Sockets skipped (unauthorized, sender, closed, backpressure)");
        broadcastDuplicate = broadcastCounter("duplicate", "Sockets skipped because the client already received the message");
        broadcastError = broadcastCounter("error", "Socket writes that failed");

        broadcastHighBackpressure = Counter.builder(MetricsNames.BROADCAST_HIGH_BACKPRESSURE_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Sends skipped above the high backpressure watermark")
            .register(registry);

        broadcastYields = Counter.builder(MetricsNames.BROADCAST_YIELDS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Actor yields during broadcast")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        broadcastLatency = Timer.builder(MetricsNames.BROADCAST_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Local fan-out duration of one message")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100)
            )
            .register(registry);

        publishLatency = Timer.builder(MetricsNames.PUBLISH_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Publish ingress to local fan-out completion")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofMillis(500)
            )
            .register(registry);

        kafkaPublishLatency = Timer.builder(MetricsNames.KAFKA_PUBLISH_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Kafka record publish latency")
            .publishPercentileHistogram()
            .register(registry);

        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, activeConnections, AtomicInteger::get)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Open WebSocket connections")
            .register(registry);
    }

    private Counter broadcastCounter(String result, String description) {
        return Counter.builder(MetricsNames.BROADCAST_SOCKETS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, result)
            .description(description)
            .register(registry);
    }

    private Counter counter(String name, String tagKey, String tagValue, String otherKey, String otherValue) {
        String id = name + '|' + tagKey + '=' + tagValue + '|' + otherKey + '=' + otherValue;
        return dynamicCounters.computeIfAbsent(id, ignored -> {
            Counter.Builder builder = Counter.builder(name)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(tagKey, tagValue);
            if (otherKey != null) {
                builder.tag(otherKey, otherValue);
            }
            return builder.register(registry);
        });
    }

    /**
     * Registers the gauge tracking resident channel actors.
     */
    public void bindActorCount(Supplier<Number> actorCount) {
        Gauge.builder(MetricsNames.ACTORS_ACTIVE, actorCount)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Channel actors resident on this node")
            .register(registry);
    }

    public void recordBroadcast(BroadcastStats stats, Duration elapsed) {
        broadcastSent.increment(stats.getSent());
        broadcastSkipped.increment(stats.getSkipped());
        broadcastDuplicate.increment(stats.getDuplicate());
        broadcastError.increment(stats.getErrors());
        broadcastHighBackpressure.increment(stats.getHighBackpressure());
        broadcastYields.increment(stats.getYields());
        broadcastLatency.record(elapsed);
    }

    /**
     * Records publish latency from a monotonic ingress timestamp (see {@code MonoTime}).
     */
    public void recordPublishLatency(double ingressMonoMillis, double nowMonoMillis) {
        publishLatency.record(Duration.ofNanos((long) ((nowMonoMillis - ingressMonoMillis) * 1_000_000)));
    }

    public void recordKafkaPublishLatency(long startNanos) {
        kafkaPublishLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordPacket(String packetType) {
        counter(MetricsNames.PACKETS_TOTAL, MetricsTags.TYPE, packetType, null, null).increment();
    }

    /**
     * @param reason one of bad_request, unauthorized, forbidden, capacity, internal
     */
    public void recordPacketRejected(String reason) {
        counter(MetricsNames.PACKETS_REJECTED_TOTAL, MetricsTags.REASON, reason, null, null).increment();
    }

    /**
     * @param transport direct or kafka
     */
    public void recordShardRpc(String transport, boolean ok) {
        counter(MetricsNames.SHARD_RPC_TOTAL, MetricsTags.TYPE, transport, MetricsTags.RESULT, ok ? "ok" : "error")
            .increment();
    }

    public void recordUsageEvent(boolean ok) {
        counter(MetricsNames.USAGE_EVENTS_TOTAL, MetricsTags.RESULT, ok ? "ok" : "error", null, null).increment();
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }
}
