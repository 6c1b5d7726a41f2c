package sh.erebus.broker.usage;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.core.msg.Topics;
import sh.erebus.core.msg.UsageEnvelope;
import sh.erebus.core.util.JsonUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Drains {@link Topics#USAGE} into the usage webhook.
 * <p>
 * All forwarders share one consumer group, so each record is posted once cluster-wide.
 * A record whose delivery still fails after the client's retries is logged and skipped.
 * </p>
 */
public class UsageWebhookForwarder {
    private static final Logger log = LoggerFactory.getLogger(UsageWebhookForwarder.class);

    static final String CONSUMER_GROUP = "erebus-usage-webhook";

    private final BrokerConfig config;
    private final UsageWebhookClient webhookClient;
    private Disposable consumer;

    public UsageWebhookForwarder(BrokerConfig config, UsageWebhookClient webhookClient) {
        this.config = config;
        this.webhookClient = webhookClient;
    }

    public void start() {
        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, CONSUMER_GROUP);
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

        ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
            .subscription(Collections.singleton(Topics.USAGE));

        consumer = forward(KafkaReceiver.create(receiverOptions)).subscribe();
        log.info("Usage webhook forwarder started (group {})", CONSUMER_GROUP);
    }

    private Flux<Void> forward(KafkaReceiver<String, String> receiver) {
        return receiver.receive()
            .concatMap(record -> {
                UsageEnvelope envelope;
                try {
                    envelope = JsonUtils.readValue(record.value(), UsageEnvelope.class);
                } catch (Exception e) {
                    log.error("Dropping undecodable usage record at offset {}", record.offset(), e);
                    record.receiverOffset().acknowledge();
                    return Mono.empty();
                }

                return webhookClient.send(envelope.getPayload())
                    .onErrorResume(err -> {
                        log.error("Usage webhook delivery failed for project {}: {}",
                            envelope.getPayload().getData().getProjectId(), err.getMessage());
                        return Mono.empty();
                    })
                    .doFinally(signal -> record.receiverOffset().acknowledge());
            })
            .onErrorContinue((err, obj) -> log.error("Error in usage forwarder loop", err));
    }

    public void stop() {
        if (consumer != null) {
            consumer.dispose();
        }
        log.info("Usage webhook forwarder stopped");
    }
}
