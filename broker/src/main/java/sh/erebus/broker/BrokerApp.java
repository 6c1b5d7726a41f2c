package sh.erebus.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import sh.erebus.broker.auth.IGrantVerifier;
import sh.erebus.broker.auth.JwtGrantVerifier;
import sh.erebus.broker.channel.ChannelActorRegistry;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.broker.http.HistoryHandler;
import sh.erebus.broker.http.HttpServer;
import sh.erebus.broker.metrics.MetricsService;
import sh.erebus.broker.metrics.PrometheusMetricsExporter;
import sh.erebus.broker.redis.RedisService;
import sh.erebus.broker.shard.IShardRegistry;
import sh.erebus.broker.shard.InMemoryShardRegistry;
import sh.erebus.broker.shard.KafkaShardRpcService;
import sh.erebus.broker.shard.RedisShardRegistry;
import sh.erebus.broker.shard.ShardMembershipService;
import sh.erebus.broker.storage.IChannelStorageFactory;
import sh.erebus.broker.storage.InMemoryChannelStorageFactory;
import sh.erebus.broker.storage.RedisChannelStorageFactory;
import sh.erebus.broker.usage.KafkaUsageReporter;
import sh.erebus.broker.usage.UsageWebhookClient;
import sh.erebus.broker.usage.UsageWebhookForwarder;
import sh.erebus.broker.ws.WebSocketUpgradeHandler;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for a broker node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /v1/pubsub (header X-Location-Hint, query or header grant)</li>
 *   <li>Host the channel shards of the locations in SERVED_LOCATIONS</li>
 *   <li>Consume shard RPCs addressed to those locations from Kafka</li>
 *   <li>Report usage to Kafka and, when WEBHOOK_BASE_URL is set, forward it to the webhook</li>
 *   <li>Expose /healthz, /readyz, /metrics and the topic history API</li>
 * </ul>
 * </p>
 */
public class BrokerApp {
    private static final Logger log = LoggerFactory.getLogger(BrokerApp.class);

    public static void main(String[] args) {
        BrokerConfig config = BrokerConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        if (config.isUseVirtualThreads()) {
            System.setProperty("reactor.schedulers.defaultBoundedElasticOnVirtualThreads", "true");
            log.info("reactor.schedulers.defaultBoundedElasticOnVirtualThreads = true");
        }

        log.info("Starting broker node: {}", config.getNodeId());
        log.info("  Kafka: {}", config.getKafkaBootstrap());
        log.info("  Storage: {}", config.getStorageMode());
        log.info("  Served locations: {}", config.getServedLocations());

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config.getNodeId());
        IGrantVerifier grantVerifier = JwtGrantVerifier.fromJwk(config.getPublicKeyJwk(), clock);

        RedisService redisService = null;
        IChannelStorageFactory storageFactory;
        IShardRegistry shardRegistry;
        if (config.getStorageMode() == BrokerConfig.StorageMode.REDIS) {
            redisService = new RedisService(config);
            storageFactory = new RedisChannelStorageFactory(redisService.getCommands());
            shardRegistry = new RedisShardRegistry(redisService.getCommands());
        } else {
            log.warn("In-memory storage: shard state is lost on restart and not shared between nodes");
            storageFactory = new InMemoryChannelStorageFactory();
            shardRegistry = new InMemoryShardRegistry();
        }

        KafkaShardRpcService shardRpcService = new KafkaShardRpcService(config, metricsService);
        KafkaUsageReporter usageReporter = new KafkaUsageReporter(config, metricsService);
        ChannelActorRegistry actorRegistry = new ChannelActorRegistry(
            config, storageFactory, grantVerifier, usageReporter, shardRpcService, metricsService, clock);
        ShardMembershipService membershipService = new ShardMembershipService(shardRegistry, shardRpcService);

        // Start Kafka consumers (block until initialized)
        shardRpcService.start(actorRegistry).block();

        UsageWebhookForwarder webhookForwarder = null;
        if (config.isWebhookEnabled()) {
            webhookForwarder = new UsageWebhookForwarder(config, new UsageWebhookClient(config.getWebhookBaseUrl()));
            webhookForwarder.start();
        }

        HttpServer httpServer = new HttpServer(
            config,
            new WebSocketUpgradeHandler(config, grantVerifier, actorRegistry, membershipService),
            new HistoryHandler(config, grantVerifier, actorRegistry),
            metricsExporter
        );
        httpServer.start();

        log.info("Broker node {} is ready", config.getNodeId());

        handleShutdown(config, httpServer, shardRpcService, usageReporter, webhookForwarder, actorRegistry, redisService);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(BrokerConfig config,
                                       HttpServer httpServer,
                                       KafkaShardRpcService shardRpcService,
                                       KafkaUsageReporter usageReporter,
                                       UsageWebhookForwarder webhookForwarder,
                                       ChannelActorRegistry actorRegistry,
                                       RedisService redisService) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            httpServer.stop();

            shardRpcService.stop().block(Duration.ofSeconds(10));
            if (webhookForwarder != null) {
                webhookForwarder.stop();
            }
            usageReporter.close();
            actorRegistry.close();

            if (redisService != null) {
                redisService.close();
            }

            log.info("Shutdown complete");
        }));
    }
}
