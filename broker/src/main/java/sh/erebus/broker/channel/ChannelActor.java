package sh.erebus.broker.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import sh.erebus.broker.auth.IGrantVerifier;
import sh.erebus.broker.metrics.MetricsService;
import sh.erebus.broker.shard.IShardRpcService;
import sh.erebus.broker.usage.IUsageReporter;
import sh.erebus.broker.ws.WebSocketConnection;
import sh.erebus.core.model.MessageBody;
import sh.erebus.core.msg.ShardRpcCall;
import sh.erebus.core.util.MonoTime;

import java.util.List;
import java.util.UUID;

/**
 * One regional shard of a channel: owns the sockets connected to it and wires the
 * channel services together.
 * <p>
 * <b>Entry points:</b>
 * <ul>
 *   <li>{@link #accept}, {@link #onMessage}, {@link #onClose}: socket lifecycle</li>
 *   <li>{@link #publishMessage}, {@link #setShardsInLocalStorage}: shard RPC methods</li>
 *   <li>{@link #getTopicHistory}: HTTP history route</li>
 * </ul>
 * Every entry point starts on the actor's serial scheduler.
 * </p>
 */
public class ChannelActor implements PublishCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ChannelActor.class);

    private final ChannelContext context;
    private final SequenceManager sequenceManager;
    private final SubscriptionManager subscriptionManager;
    private final MessageBuffer messageBuffer;
    private final MessageBroadcaster messageBroadcaster;
    private final ShardManager shardManager;
    private final MessageHandler messageHandler;
    private final IShardRpcService shardRpcService;
    private final MetricsService metricsService;

    public ChannelActor(ChannelContext context, IGrantVerifier grantVerifier, IUsageReporter usageReporter,
                        IShardRpcService shardRpcService, MetricsService metricsService) {
        this.context = context;
        this.shardRpcService = shardRpcService;
        this.metricsService = metricsService;

        this.messageBuffer = new MessageBuffer(context);
        this.sequenceManager = new SequenceManager(context);
        this.shardManager = new ShardManager(context);
        this.messageBroadcaster = new MessageBroadcaster(
            context, BroadcastConfig.from(context.getConfig()), messageBuffer, usageReporter, metricsService);
        this.subscriptionManager = new SubscriptionManager(context, messageBroadcaster);
        this.messageHandler = new MessageHandler(
            context, subscriptionManager, messageBuffer, this, grantVerifier, usageReporter, metricsService);

        log.debug("Channel actor created for {}", context.getShardKey());
    }

    public String getShardKey() {
        return context.getShardKey();
    }

    public int getConnectionCount() {
        return context.getConnectionCount();
    }

    /**
     * Stores the shard's location, then takes ownership of the socket.
     */
    public Mono<Void> accept(String locationHint, WebSocketConnection connection) {
        return onActor(shardManager.setLocationHint(locationHint)
            .then(Mono.fromRunnable(() -> {
                context.addConnection(connection);
                metricsService.connectionOpened();
                log.debug("Accepted connection {} on {} ({} open)",
                    connection.getId(), context.getShardKey(), context.getConnectionCount());
            })));
    }

    public Mono<Void> onMessage(WebSocketConnection connection, String raw) {
        return onActor(messageHandler.handleMessage(connection, raw));
    }

    /**
     * Drops the socket and removes its client from every topic of its grant.
     */
    public Mono<Void> onClose(WebSocketConnection connection) {
        return onActor(Mono.defer(() -> {
            if (!context.removeConnection(connection)) {
                return Mono.empty();
            }
            metricsService.connectionClosed();
            return messageHandler.handleClose(connection)
                .onErrorResume(err -> {
                    log.error("Cleanup of connection {} on {} failed", connection.getId(), context.getShardKey(), err);
                    return Mono.empty();
                });
        }));
    }

    /**
     * Shard RPC: delivers a message sequenced by another shard to the sockets of this one.
     */
    public Mono<BroadcastStats> publishMessage(PublishMessageParams params) {
        return onActor(messageBroadcaster.publishMessage(params));
    }

    /**
     * Shard RPC: replaces this shard's sibling list.
     */
    public Mono<Void> setShardsInLocalStorage(List<String> shardKeys) {
        return onActor(shardManager.setShardsInLocalStorage(shardKeys));
    }

    public Mono<HistoryPage> getTopicHistory(String projectId, String channel, String topic,
                                             String cursor, int limit, HistoryDirection direction) {
        return onActor(messageBuffer.getTopicHistory(projectId, channel, topic, cursor, limit, direction));
    }

    public Mono<ShardStatus> getShardStatus() {
        return onActor(shardManager.getShardStatus());
    }

    @Override
    public Mono<PublishOutcome> broadcastToAllShards(MessageBody payload, String senderId, String topic,
                                                     String projectId, String keyId, String channel,
                                                     double tIngress, double tEnqueued) {
        return Mono.zip(
                sequenceManager.generateSequence(projectId, channel, topic),
                shardManager.getRemoteShards(),
                subscriptionManager.getSubscribers(projectId, channel, topic))
            .flatMap(tuple -> {
                String seq = tuple.getT1();
                List<String> remoteShards = tuple.getT2();
                List<String> subscribers = tuple.getT3();

                MessageBody message = payload.toBuilder()
                    .id(UUID.randomUUID().toString())
                    .topic(topic)
                    .senderId(senderId)
                    .seq(seq)
                    .sentAt(MonoTime.toWallClock(tIngress))
                    .timeIngress(tIngress)
                    .timeEnqueued(tEnqueued)
                    .timeBroadcastBegin(MonoTime.nowMillis())
                    .timeWsWriteEnd(null)
                    .timeBroadcastEnd(null)
                    .build();

                log.debug("Publishing {} on {} to {} subscribers and {} remote shards",
                    seq, topic, subscribers.size(), remoteShards.size());

                // Remote shards get the message as it was before the local write timings
                MessageBody replica = message.toBuilder().build();
                PublishMessageParams local = PublishMessageParams.builder()
                    .message(message)
                    .senderId(senderId)
                    .subscriberIds(subscribers)
                    .projectId(projectId)
                    .keyId(keyId)
                    .channel(channel)
                    .topic(topic)
                    .seq(seq)
                    .build();

                // Forwarding starts with the local fan-out; a local failure still lets it finish
                return Mono.whenDelayError(
                        messageBroadcaster.publishMessage(local),
                        forwardToShards(remoteShards, replica, senderId, subscribers,
                            projectId, keyId, channel, topic, seq, tIngress))
                    .thenReturn(new PublishOutcome(seq, message.getId()));
            });
    }

    private Mono<Void> forwardToShards(List<String> remoteShards, MessageBody message, String senderId,
                                       List<String> subscribers, String projectId, String keyId,
                                       String channel, String topic, String seq, double tIngress) {
        if (remoteShards.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(remoteShards)
            .flatMap(shardKey -> shardRpcService.invoke(new ShardRpcCall.PublishMessage(
                    shardKey, message, senderId, subscribers, projectId, keyId, channel, topic, seq, tIngress))
                .onErrorResume(err -> {
                    log.warn("Failed to forward {} on {} to shard {}: {}", seq, topic, shardKey, err.getMessage());
                    return Mono.empty();
                }))
            .then();
    }

    private <T> Mono<T> onActor(Mono<T> work) {
        return Mono.defer(() -> work).subscribeOn(context.getScheduler());
    }
}
