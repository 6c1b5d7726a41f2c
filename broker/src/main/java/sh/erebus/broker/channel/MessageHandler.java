package sh.erebus.broker.channel;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import sh.erebus.broker.auth.GrantVerificationException;
import sh.erebus.broker.auth.IGrantVerifier;
import sh.erebus.broker.metrics.MetricsService;
import sh.erebus.broker.usage.IUsageReporter;
import sh.erebus.broker.ws.CloseCodes;
import sh.erebus.broker.ws.ConnectionGrants;
import sh.erebus.broker.ws.WebSocketConnection;
import sh.erebus.core.key.DistributedKey;
import sh.erebus.core.model.Grant;
import sh.erebus.core.model.MessageBody;
import sh.erebus.core.msg.AckPacket;
import sh.erebus.core.msg.ConnectPacket;
import sh.erebus.core.msg.Packet;
import sh.erebus.core.msg.PublishErrorCode;
import sh.erebus.core.msg.PublishPacket;
import sh.erebus.core.msg.SubscribePacket;
import sh.erebus.core.msg.SubscriptionStatus;
import sh.erebus.core.msg.UnsubscribePacket;
import sh.erebus.core.msg.UsageEvent;
import sh.erebus.core.util.BytesUtils;
import sh.erebus.core.util.JsonUtils;
import sh.erebus.core.util.MonoTime;

import java.util.List;
import java.util.Optional;

/**
 * Client protocol of a channel shard.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>connect: {grantJWT}; verifies the grant and attaches it to the socket. A socket keeps its first grant,
 *   later connects are ignored</li>
 *   <li>subscribe: {requestId?, topic}; acked, then missed messages are replayed</li>
 *   <li>unsubscribe: {requestId?, topic}; acked</li>
 *   <li>publish: {requestId?, topic, payload, clientMsgId?, ack?}; acked only when {@code ack} is true</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (server → client): ack, presence, and the published message bodies themselves.
 * </p>
 * <p>
 * <b>Failure policy:</b>
 * <ul>
 *   <li>unparseable, invalid or unknown packets, failed connect, missing grant: close 4400</li>
 *   <li>processing failures: close 4500</li>
 *   <li>authorization failures: dropped and logged, the socket stays open</li>
 *   <li>full topic: subscribe dropped and logged, the socket stays open</li>
 * </ul>
 * </p>
 */
public class MessageHandler {
    private static final Logger log = LoggerFactory.getLogger(MessageHandler.class);

    private final ChannelContext context;
    private final SubscriptionManager subscriptionManager;
    private final MessageBuffer messageBuffer;
    private final PublishCoordinator publishCoordinator;
    private final IGrantVerifier grantVerifier;
    private final IUsageReporter usageReporter;
    private final MetricsService metricsService;

    public MessageHandler(ChannelContext context, SubscriptionManager subscriptionManager,
                          MessageBuffer messageBuffer, PublishCoordinator publishCoordinator,
                          IGrantVerifier grantVerifier, IUsageReporter usageReporter,
                          MetricsService metricsService) {
        this.context = context;
        this.subscriptionManager = subscriptionManager;
        this.messageBuffer = messageBuffer;
        this.publishCoordinator = publishCoordinator;
        this.grantVerifier = grantVerifier;
        this.usageReporter = usageReporter;
        this.metricsService = metricsService;
    }

    /**
     * Processes one text frame. Never errors: every failure ends in a log line, an ack or a close.
     */
    public Mono<Void> handleMessage(WebSocketConnection connection, String raw) {
        return Mono.defer(() -> {
            metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(raw));

            JsonNode tree;
            try {
                tree = JsonUtils.mapper().readTree(raw);
            } catch (Exception e) {
                log.warn("Unparseable frame on connection {}: {}", connection.getId(), e.getMessage());
                return reject(connection, "Invalid JSON");
            }

            Packet packet;
            try {
                packet = JsonUtils.mapper().treeToValue(tree, Packet.class);
            } catch (Exception e) {
                log.warn("Invalid packet on connection {}: {}", connection.getId(), e.getMessage());
                return reject(connection, "Invalid packet format");
            }
            if (packet == null || !packet.isWellFormed()) {
                log.warn("Packet failed validation on connection {}: {}", connection.getId(), abbreviate(raw));
                return reject(connection, "Invalid packet format");
            }

            log.debug("Received {} packet on connection {}", packet.getPacketType(), connection.getId());
            return dispatch(connection, packet)
                .onErrorResume(err -> {
                    log.error("Error processing {} packet on connection {}",
                        packet.getPacketType(), connection.getId(), err);
                    metricsService.recordPacketRejected("internal");
                    connection.close(CloseCodes.INTERNAL_SERVER_ERROR, "Processing failed");
                    return Mono.empty();
                });
        });
    }

    private Mono<Void> dispatch(WebSocketConnection connection, Packet packet) {
        if (packet instanceof ConnectPacket) {
            metricsService.recordPacket(ConnectPacket.TYPE);
            return handleConnect(connection, (ConnectPacket) packet);
        }
        if (packet instanceof SubscribePacket) {
            metricsService.recordPacket(SubscribePacket.TYPE);
            return handleSubscribe(connection, (SubscribePacket) packet);
        }
        if (packet instanceof UnsubscribePacket) {
            metricsService.recordPacket(UnsubscribePacket.TYPE);
            return handleUnsubscribe(connection, (UnsubscribePacket) packet);
        }
        if (packet instanceof PublishPacket) {
            metricsService.recordPacket(PublishPacket.TYPE);
            return handlePublish(connection, (PublishPacket) packet);
        }
        // ack and presence only travel server → client
        log.warn("Client sent server-only packet type {} on connection {}", packet.getPacketType(), connection.getId());
        return reject(connection, "Unknown packet type");
    }

    private Mono<Void> handleConnect(WebSocketConnection connection, ConnectPacket packet) {
        Optional<Grant> attached = ConnectionGrants.read(connection);
        if (attached.isPresent()) {
            log.warn("Ignoring repeated connect on {}: already authenticated as {}",
                connection.getId(), attached.get().getUserId());
            metricsService.recordPacketRejected("forbidden");
            return Mono.empty();
        }

        Grant grant;
        try {
            grant = grantVerifier.verify(packet.getGrantJWT());
        } catch (GrantVerificationException e) {
            log.warn("Rejecting connect on {}: {}", connection.getId(), e.getMessage());
            return reject(connection, "Invalid JWT");
        }

        long nowSeconds = context.getClock().instant().getEpochSecond();
        if (grant.isExpiredAt(nowSeconds)) {
            log.warn("Rejecting connect on {}: grant expired at {}", connection.getId(), grant.getExpiresAt());
            return reject(connection, "Grant expired");
        }

        DistributedKey.Parts shard = DistributedKey.parse(context.getShardKey());
        if (!shard.getProjectId().equals(grant.getProjectId()) || !shard.getResource().equals(grant.getChannel())) {
            log.warn("Rejecting connect on {}: grant is for {}/{}, shard is {}", connection.getId(),
                grant.getProjectId(), grant.getChannel(), context.getShardKey());
            return reject(connection, "Grant does not match channel");
        }

        ConnectionGrants.attach(connection, grant);
        try (MDC.MDCCloseable ignored = MDC.putCloseable("clientId", grant.getUserId())) {
            log.info("Client {} authenticated on {}", grant.getUserId(), context.getShardKey());
        }

        return usageReporter.report(UsageEvent.CONNECT, grant.getProjectId(), grant.getKeyId(), 0);
    }

    private Mono<Void> handleSubscribe(WebSocketConnection connection, SubscribePacket packet) {
        Optional<Grant> maybeGrant = requireGrant(connection);
        if (maybeGrant.isEmpty()) {
            return Mono.empty();
        }
        Grant grant = maybeGrant.get();
        String clientId = grant.getUserId();
        String topic = packet.getTopic();

        return subscriptionManager.isSubscribed(grant.getProjectId(), grant.getChannel(), topic, clientId)
            .flatMap(alreadySubscribed -> {
                if (alreadySubscribed) {
                    log.debug("Client {} already subscribed to {}", clientId, topic);
                    return Mono.<Void>empty();
                }
                if (!grant.hasTopicAccess(topic)) {
                    log.warn("Client {} is not authorized to subscribe to {}", clientId, topic);
                    metricsService.recordPacketRejected("forbidden");
                    return Mono.<Void>empty();
                }

                return subscriptionManager.subscribe(grant.getProjectId(), grant.getChannel(), topic, clientId)
                    .then(Mono.fromRunnable(() -> send(connection,
                        AckPacket.subscription(packet.getRequestId(), topic, SubscriptionStatus.SUBSCRIBED))))
                    .then(usageReporter.report(UsageEvent.SUBSCRIBE, grant.getProjectId(), grant.getKeyId(), 0))
                    .then(deliverMissedMessages(connection, grant, topic))
                    .onErrorResume(CapacityExceededException.class, err -> {
                        log.warn("Client {} could not subscribe: {}", clientId, err.getMessage());
                        metricsService.recordPacketRejected("capacity");
                        return Mono.empty();
                    })
                    .onErrorResume(err -> {
                        log.error("Subscription of {} to {} failed", clientId, topic, err);
                        metricsService.recordPacketRejected("internal");
                        connection.close(CloseCodes.INTERNAL_SERVER_ERROR, "Subscription failed");
                        return Mono.empty();
                    });
            });
    }

    private Mono<Void> handleUnsubscribe(WebSocketConnection connection, UnsubscribePacket packet) {
        Optional<Grant> maybeGrant = requireGrant(connection);
        if (maybeGrant.isEmpty()) {
            return Mono.empty();
        }
        Grant grant = maybeGrant.get();
        String topic = packet.getTopic();

        return subscriptionManager.unsubscribe(grant.getProjectId(), grant.getChannel(), topic, grant.getUserId())
            .then(Mono.fromRunnable(() -> send(connection,
                AckPacket.subscription(packet.getRequestId(), topic, SubscriptionStatus.UNSUBSCRIBED))))
            .then()
            .onErrorResume(err -> {
                log.error("Unsubscribe of {} from {} failed", grant.getUserId(), topic, err);
                return Mono.empty();
            });
    }

    private Mono<Void> handlePublish(WebSocketConnection connection, PublishPacket packet) {
        double tIngress = MonoTime.nowMillis();

        Optional<Grant> maybeGrant = requireGrant(connection);
        if (maybeGrant.isEmpty()) {
            return Mono.empty();
        }
        Grant grant = maybeGrant.get();
        String clientId = grant.getUserId();
        String topic = packet.getTopic();

        if (!grant.hasWriteAccess(topic)) {
            log.warn("Client {} lacks write access to {}", clientId, topic);
            metricsService.recordPacketRejected("forbidden");
            sendPublishError(connection, packet, PublishErrorCode.FORBIDDEN, "Insufficient permissions for topic");
            return Mono.empty();
        }

        return subscriptionManager.isSubscribed(grant.getProjectId(), grant.getChannel(), topic, clientId)
            .flatMap(subscribed -> {
                if (!subscribed) {
                    log.warn("Client {} published to {} without subscribing", clientId, topic);
                    metricsService.recordPacketRejected("forbidden");
                    sendPublishError(connection, packet, PublishErrorCode.FORBIDDEN,
                        "Must be subscribed to topic before publishing");
                    return Mono.<Void>empty();
                }

                double tEnqueued = MonoTime.nowMillis();
                MessageBody payload = packet.getPayload().toBuilder()
                    .clientMsgId(packet.getClientMsgId() != null ? packet.getClientMsgId() : packet.getPayload().getClientMsgId())
                    .build();

                return publishCoordinator.broadcastToAllShards(payload, clientId, topic,
                        grant.getProjectId(), grant.getKeyId(), grant.getChannel(), tIngress, tEnqueued)
                    .doOnNext(outcome -> {
                        if (packet.wantsAck()) {
                            send(connection, AckPacket.publishOk(packet.getRequestId(), topic,
                                outcome.getServerMsgId(), outcome.getSeq(), tIngress));
                        }
                        metricsService.recordPublishLatency(tIngress, MonoTime.nowMillis());
                        log.debug("Publish by {} on {} accepted as {}", clientId, topic, outcome.getSeq());
                    })
                    .then()
                    .onErrorResume(err -> {
                        log.error("Publish by {} on {} failed", clientId, topic, err);
                        metricsService.recordPacketRejected("internal");
                        sendPublishError(connection, packet, PublishErrorCode.INTERNAL, "Message publishing failed");
                        connection.close(CloseCodes.INTERNAL_SERVER_ERROR, "Publish failed");
                        return Mono.empty();
                    });
            });
    }

    /**
     * Replays buffered messages newer than the client's last-seen cursor, then moves the
     * cursor to the last message actually written. Failures are logged only.
     */
    Mono<Void> deliverMissedMessages(WebSocketConnection connection, Grant grant, String topic) {
        String projectId = grant.getProjectId();
        String channel = grant.getChannel();
        String clientId = grant.getUserId();

        return messageBuffer.getLastSeen(projectId, channel, topic, clientId)
            .flatMap(lastSeen -> messageBuffer.getMessagesAfter(projectId, channel, topic, lastSeen))
            .flatMap(messages -> {
                String lastDelivered = null;
                for (MessageBody message : messages) {
                    if (!connection.isOpen()) {
                        log.debug("Connection {} closed during catch-up", connection.getId());
                        break;
                    }
                    String json = JsonUtils.writeValueAsString(message);
                    connection.send(json);
                    metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(json));
                    lastDelivered = message.getSeq();
                }
                if (lastDelivered == null) {
                    return Mono.<Void>empty();
                }
                log.debug("Replayed {} missed messages on {} to {}", messages.size(), topic, clientId);
                return messageBuffer.updateLastSeenSingle(projectId, channel, topic, clientId, lastDelivered);
            })
            .onErrorResume(err -> {
                log.error("Failed to replay missed messages on {} to {}", topic, clientId, err);
                return Mono.empty();
            });
    }

    /**
     * Removes a closing socket's client from every topic in its grant.
     */
    public Mono<Void> handleClose(WebSocketConnection connection) {
        Optional<Grant> grant = ConnectionGrants.read(connection);
        if (grant.isEmpty()) {
            return Mono.empty();
        }
        List<String> topics = grant.get().topicNames();
        log.debug("Connection {} of {} closed, cleaning up {} topics",
            connection.getId(), grant.get().getUserId(), topics.size());
        return subscriptionManager.bulkUnsubscribe(grant.get().getUserId(), grant.get().getProjectId(),
            grant.get().getChannel(), topics);
    }

    private Optional<Grant> requireGrant(WebSocketConnection connection) {
        Optional<Grant> grant = ConnectionGrants.read(connection);
        if (grant.isEmpty()) {
            log.warn("Connection {} sent a packet before a valid connect", connection.getId());
            metricsService.recordPacketRejected("unauthorized");
            connection.close(CloseCodes.BAD_REQUEST, "Invalid grant");
        }
        return grant;
    }

    private Mono<Void> reject(WebSocketConnection connection, String reason) {
        metricsService.recordPacketRejected("bad_request");
        connection.close(CloseCodes.BAD_REQUEST, reason);
        return Mono.empty();
    }

    private void sendPublishError(WebSocketConnection connection, PublishPacket packet,
                                  PublishErrorCode code, String message) {
        if (packet.wantsAck()) {
            send(connection, AckPacket.publishError(packet.getRequestId(), packet.getTopic(), code, message));
        }
    }

    private void send(WebSocketConnection connection, Packet packet) {
        if (!connection.isOpen()) {
            return;
        }
        String json = JsonUtils.writeValueAsString(packet);
        connection.send(json);
        metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(json));
    }

    private static String abbreviate(String raw) {
        return raw.length() > 200 ? raw.substring(0, 200) + "..." : raw;
    }
}
