package sh.erebus.broker.shard;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.broker.metrics.MetricsService;
import sh.erebus.core.key.DistributedKey;
import sh.erebus.core.key.InvalidDistributedKeyException;
import sh.erebus.core.msg.ShardRpcCall;
import sh.erebus.core.msg.Topics;
import sh.erebus.core.util.JsonUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shard RPC over per-location Kafka topics.
 * <p>
 * Routing flow:
 * <pre>
 * 1. location = last segment of the target shard key
 * 2. location served by this node → dispatch in-process, no Kafka hop
 * 3. otherwise → topic = "erebus.shard.rpc.{location}", key = target shard key
 * 4. the node serving that location consumes the topic and dispatches locally
 * </pre>
 * </p>
 * <p>
 * Keying by shard key keeps the calls for one shard on one partition, so a shard sees
 * replicated publishes in the order they were sent. Each location is served by exactly one
 * node; that node's consumer group is the only reader of the location's topic.
 * </p>
 */
public class KafkaShardRpcService implements IShardRpcService {
    private static final Logger log = LoggerFactory.getLogger(KafkaShardRpcService.class);

    private static final int DEFAULT_PARTITIONS = 1;
    private static final short REPLICATION_FACTOR = 1;

    private final BrokerConfig config;
    private final MetricsService metricsService;
    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    private volatile ShardRpcDispatcher dispatcher;
    private Disposable consumer;

    public KafkaShardRpcService(BrokerConfig config, MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        producerProps.put(ProducerConfig.RETRIES_CONFIG, Integer.MAX_VALUE);
        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Shard RPC producer and admin client initialized");
    }

    /**
     * Creates the RPC topics of the served locations (if missing) and subscribes to them.
     */
    @Override
    public Mono<Void> start(ShardRpcDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        List<String> topics = config.getServedLocations().stream()
            .map(Topics::shardRpcTopicFor)
            .collect(Collectors.toList());

        log.info("Node {} serving locations {} via topics {}", config.getNodeId(), config.getServedLocations(), topics);

        return Flux.fromIterable(topics)
            .concatMap(topic -> createTopicIfNotExists(topic, DEFAULT_PARTITIONS, REPLICATION_FACTOR))
            .then()
            .publishOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> {
                Map<String, Object> consumerProps = new HashMap<>();
                consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
                consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "erebus-shard-rpc-" + config.getNodeId());
                consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
                consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

                ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
                    .subscription(topics);

                consumer = listen(KafkaReceiver.create(receiverOptions)).subscribe();
                log.info("Shard RPC consumer started for node {}", config.getNodeId());
            });
    }

    private Flux<Void> listen(KafkaReceiver<String, String> receiver) {
        return receiver.receive()
            .concatMap(record -> {
                ShardRpcCall call;
                try {
                    call = JsonUtils.readValue(record.value(), ShardRpcCall.class);
                } catch (Exception e) {
                    log.error("Dropping undecodable shard RPC from {}", record.topic(), e);
                    record.receiverOffset().acknowledge();
                    return Mono.empty();
                }

                log.debug("Shard RPC {} received for {}", call.getMethod(), call.getTargetShardKey());
                return dispatcher.dispatch(call)
                    .doOnSuccess(v -> metricsService.recordShardRpc("kafka", true))
                    .onErrorResume(err -> {
                        log.error("Shard RPC {} to {} failed", call.getMethod(), call.getTargetShardKey(), err);
                        metricsService.recordShardRpc("kafka", false);
                        return Mono.empty();
                    })
                    .doFinally(signal -> record.receiverOffset().acknowledge());
            })
            .onErrorContinue((err, obj) -> log.error("Error in shard RPC consumer loop", err));
    }

    @Override
    public Mono<Void> invoke(ShardRpcCall call) {
        return Mono.defer(() -> {
            String location = DistributedKey.locationOf(call.getTargetShardKey()).orElse(null);
            if (location == null) {
                return Mono.error(new InvalidDistributedKeyException(
                    "Shard RPC target is not a shard key: " + call.getTargetShardKey()));
            }

            if (config.servesLocation(location)) {
                if (dispatcher == null) {
                    return Mono.error(new IllegalStateException("Shard RPC service not started"));
                }
                return dispatcher.dispatch(call)
                    .doOnSuccess(v -> metricsService.recordShardRpc("direct", true))
                    .doOnError(err -> metricsService.recordShardRpc("direct", false));
            }

            String topic = Topics.shardRpcTopicFor(location);
            ProducerRecord<String, String> record = new ProducerRecord<>(
                topic, call.getTargetShardKey(), JsonUtils.writeValueAsString(call));
            long kafkaStartNanos = System.nanoTime();

            return sender.send(Mono.just(SenderRecord.create(record, null)))
                .retry(3)
                .doOnNext(result -> {
                    metricsService.recordKafkaPublishLatency(kafkaStartNanos);
                    log.debug("Sent shard RPC {} to {} on {}", call.getMethod(), call.getTargetShardKey(), topic);
                })
                .doOnError(err -> metricsService.recordShardRpc("kafka", false))
                .then();
        });
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }
                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);
                    return adminClient.createTopics(Collections.singleton(new NewTopic(topicName, partitions, replicationFactor)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public Mono<Void> stop() {
        if (consumer != null) {
            consumer.dispose();
        }
        sender.close();
        adminClient.close();
        log.info("Shard RPC service stopped");
        return Mono.empty();
    }
}
