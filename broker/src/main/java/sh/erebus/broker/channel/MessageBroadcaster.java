package sh.erebus.broker.channel;

import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import sh.erebus.broker.metrics.MetricsService;
import sh.erebus.broker.usage.IUsageReporter;
import sh.erebus.broker.ws.ConnectionGrants;
import sh.erebus.broker.ws.WebSocketConnection;
import sh.erebus.core.model.Grant;
import sh.erebus.core.model.MessageBody;
import sh.erebus.core.msg.PresencePacket;
import sh.erebus.core.msg.UsageEvent;
import sh.erebus.core.util.BytesUtils;
import sh.erebus.core.util.JsonUtils;
import sh.erebus.core.util.MonoTime;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fans a sequenced message out to the sockets connected to this shard.
 * <p>
 * <b>Per socket, in order:</b>
 * <ol>
 *   <li>no readable grant: skip</li>
 *   <li>client already served by another of its sockets: duplicate</li>
 *   <li>{@code huh?} scope: send the informational notice instead of the message</li>
 *   <li>no read scope, the sender itself, or not a subscriber: skip</li>
 *   <li>closed socket: skip</li>
 *   <li>buffered bytes above the high watermark: skip; above the low one: yield, then send</li>
 * </ol>
 * </p>
 * <p>
 * The message is serialized once. Sockets are walked in batches and the actor is
 * yielded between batches. Once the fan-out is done the message is buffered, the
 * last-seen cursor of every subscriber is advanced and a usage event is emitted;
 * failures of those steps are logged and never reach the publisher.
 * </p>
 */
public class MessageBroadcaster implements PresenceListener {
    private static final Logger log = LoggerFactory.getLogger(MessageBroadcaster.class);

    static final String HUH_NOTICE = JsonUtils.writeValueAsString(Map.of(
        "type", "info",
        "message", "Curious wanderer! Embark on your quest for knowledge at https://docs.erebus.sh/"
    ));

    private final ChannelContext context;
    private final BroadcastConfig config;
    private final MessageBuffer messageBuffer;
    private final IUsageReporter usageReporter;
    private final MetricsService metricsService;

    public MessageBroadcaster(ChannelContext context, BroadcastConfig config, MessageBuffer messageBuffer,
                              IUsageReporter usageReporter, MetricsService metricsService) {
        this.context = context;
        this.config = config;
        this.messageBuffer = messageBuffer;
        this.usageReporter = usageReporter;
        this.metricsService = metricsService;
    }

    public Mono<BroadcastStats> publishMessage(PublishMessageParams params) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            MessageBody message = params.getMessage();
            String serialized = JsonUtils.writeValueAsString(message);
            Set<String> subscribers = new HashSet<>(params.getSubscriberIds());
            Set<String> delivered = new HashSet<>();
            BroadcastStats stats = new BroadcastStats();

            List<List<WebSocketConnection>> batches = Lists.partition(context.getConnections(), config.getBatchSize());

            return Flux.range(0, batches.size())
                .concatMap(i -> Flux.fromIterable(batches.get(i))
                    .concatMap(connection -> offer(connection, serialized, params, subscribers, delivered))
                    .doOnNext(stats::record)
                    .then(i < batches.size() - 1
                        ? context.yieldControl().doOnSuccess(v -> stats.recordYield())
                        : Mono.<Void>empty()))
                .then(Mono.fromRunnable(() -> {
                    double end = MonoTime.nowMillis();
                    message.setTimeWsWriteEnd(end);
                    message.setTimeBroadcastEnd(end);

                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                    metricsService.recordBroadcast(stats, elapsed);
                    log.debug("Broadcast of {} on {} done in {}ms: {}",
                        params.getSeq(), params.getTopic(), elapsed.toMillis(), stats);
                }))
                .then(runBackgroundTasks(params))
                .thenReturn(stats);
        });
    }

    private Mono<SendResult> offer(WebSocketConnection connection, String serialized, PublishMessageParams params,
                                   Set<String> subscribers, Set<String> delivered) {
        return Mono.defer(() -> {
                Optional<Grant> grant = ConnectionGrants.read(connection);
                if (grant.isEmpty()) {
                    return Mono.just(SendResult.SKIPPED);
                }
                String clientId = grant.get().getUserId();
                String topic = params.getTopic();

                if (delivered.contains(clientId)) {
                    return Mono.just(SendResult.DUPLICATE);
                }

                if (grant.get().hasHuhAccess(topic)) {
                    if (!connection.isOpen()) {
                        return Mono.just(SendResult.SKIPPED);
                    }
                    send(connection, HUH_NOTICE);
                    delivered.add(clientId);
                    return Mono.just(SendResult.SENT);
                }

                if (!grant.get().hasReadAccess(topic)) {
                    return Mono.just(SendResult.SKIPPED);
                }
                if (clientId.equals(params.getSenderId()) || !subscribers.contains(clientId)) {
                    return Mono.just(SendResult.SKIPPED);
                }
                if (!connection.isOpen()) {
                    return Mono.just(SendResult.SKIPPED);
                }

                return admit(connection).map(admitted -> {
                    if (!admitted) {
                        return SendResult.HIGH_BACKPRESSURE;
                    }
                    send(connection, serialized);
                    delivered.add(clientId);
                    return SendResult.SENT;
                });
            })
            .onErrorResume(err -> {
                log.warn("Failed to deliver {} to connection {}: {}", params.getSeq(), connection.getId(), err.getMessage());
                return Mono.just(SendResult.ERROR);
            });
    }

    /**
     * @return false when the socket is too far behind to take another frame
     */
    private Mono<Boolean> admit(WebSocketConnection connection) {
        long buffered = connection.getBufferedAmount();
        if (buffered > config.getBackpressureHighBytes()) {
            return Mono.just(false);
        }
        if (buffered > config.getBackpressureLowBytes()) {
            return context.yieldControl().thenReturn(true);
        }
        return Mono.just(true);
    }

    private void send(WebSocketConnection connection, String text) {
        connection.send(text);
        metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(text));
    }

    private Mono<Void> runBackgroundTasks(PublishMessageParams params) {
        MessageBody message = params.getMessage();
        long payloadLength = message.getPayload() == null ? 0 : message.getPayload().length();

        return Mono.when(
            messageBuffer.bufferMessage(message, params.getProjectId(), params.getChannel(),
                    params.getTopic(), params.getSeq())
                .onErrorResume(err -> {
                    log.error("Failed to buffer message {} on {}", params.getSeq(), params.getTopic(), err);
                    return Mono.empty();
                }),
            messageBuffer.updateLastSeenBulk(params.getSubscriberIds(), params.getProjectId(),
                    params.getChannel(), params.getTopic(), params.getSeq())
                .onErrorResume(err -> {
                    log.error("Failed to advance last-seen to {} on {}", params.getSeq(), params.getTopic(), err);
                    return Mono.empty();
                }),
            usageReporter.report(UsageEvent.MESSAGE, params.getProjectId(), params.getKeyId(), payloadLength)
                .onErrorResume(err -> {
                    log.error("Failed to report message usage for project {}", params.getProjectId(), err);
                    return Mono.empty();
                })
        );
    }

    /**
     * Sends a presence change to the local sockets of the topic's subscribers. Sockets of the
     * client whose presence changed get a copy that also lists the subscribers.
     */
    public Mono<Void> broadcastPresence(PresencePacket presence, List<String> subscribers) {
        return Mono.defer(() -> {
            String generic = JsonUtils.writeValueAsString(presence);
            String forSelf = JsonUtils.writeValueAsString(presence.withSubscribers(List.copyOf(subscribers)));
            Set<String> recipients = new HashSet<>(subscribers);

            List<List<WebSocketConnection>> batches =
                Lists.partition(context.getConnections(), config.getPresenceBatchSize());

            return Flux.range(0, batches.size())
                .concatMap(i -> Flux.fromIterable(batches.get(i))
                    .concatMap(connection -> offerPresence(connection, presence.getClientId(), recipients, generic, forSelf))
                    .then(i < batches.size() - 1 ? context.yieldControl() : Mono.<Void>empty()))
                .count()
                .doOnSuccess(v -> log.debug("Presence {} of {} on {} sent",
                    presence.getStatus(), presence.getClientId(), presence.getTopic()))
                .then();
        });
    }

    @Override
    public Mono<Void> onPresenceChange(PresencePacket presence, List<String> subscribers) {
        return broadcastPresence(presence, subscribers);
    }

    private Mono<Boolean> offerPresence(WebSocketConnection connection, String subjectId, Set<String> recipients,
                                        String generic, String forSelf) {
        return Mono.defer(() -> {
                if (!connection.isOpen()) {
                    return Mono.just(false);
                }
                Optional<String> clientId = ConnectionGrants.read(connection).map(Grant::getUserId);
                if (clientId.isEmpty() || !recipients.contains(clientId.get())) {
                    return Mono.just(false);
                }
                return admit(connection).map(admitted -> {
                    if (admitted) {
                        send(connection, clientId.get().equals(subjectId) ? forSelf : generic);
                    }
                    return admitted;
                });
            })
            .onErrorResume(err -> {
                log.debug("Failed to send presence to connection {}: {}", connection.getId(), err.getMessage());
                return Mono.just(false);
            });
    }
}
