package sh.erebus.broker.usage;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.broker.metrics.MetricsService;
import sh.erebus.core.msg.Topics;
import sh.erebus.core.msg.UsageEnvelope;
import sh.erebus.core.msg.UsageEvent;
import sh.erebus.core.util.JsonUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishes usage envelopes to {@link Topics#USAGE}, keyed by project id.
 */
public class KafkaUsageReporter implements IUsageReporter {
    private static final Logger log = LoggerFactory.getLogger(KafkaUsageReporter.class);

    private final KafkaSender<String, String> sender;
    private final MetricsService metricsService;

    public KafkaUsageReporter(BrokerConfig config, MetricsService metricsService) {
        this.metricsService = metricsService;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // Usage is best effort; no idempotence, a lost record is only a billing gap
        producerProps.put(ProducerConfig.ACKS_CONFIG, "1");
        producerProps.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        log.info("Usage reporter initialized on topic {}", Topics.USAGE);
    }

    @Override
    public Mono<Void> report(UsageEvent event, String projectId, String keyId, long payloadLength) {
        return Mono.defer(() -> {
                String json = JsonUtils.writeValueAsString(UsageEnvelope.of(event, projectId, keyId, payloadLength));
                ProducerRecord<String, String> record = new ProducerRecord<>(Topics.USAGE, projectId, json);
                return sender.send(Mono.just(SenderRecord.create(record, null))).then();
            })
            .doOnSuccess(v -> {
                metricsService.recordUsageEvent(true);
                log.debug("Usage {} reported for project {}", event, projectId);
            })
            .onErrorResume(err -> {
                metricsService.recordUsageEvent(false);
                log.warn("Failed to report usage {} for project {}: {}", event, projectId, err.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public void close() {
        sender.close();
        log.info("Usage reporter closed");
    }
}
