package sh.erebus.broker.config;

import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration for a broker node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class BrokerConfig {

    String nodeId;
    int httpPort;
    String kafkaBootstrap;
    String redisUrl;
    StorageMode storageMode;
    /**
     * Locations whose shards this node hosts. Shard RPCs for these are dispatched in-process
     * and this node consumes their Kafka RPC topics.
     */
    List<String> servedLocations;
    /**
     * Ed25519 public key as an OKP JWK (JSON text).
     */
    String publicKeyJwk;
    /**
     * Usage webhook base URL; blank disables the forwarder on this node.
     */
    String webhookBaseUrl;
    int messageTtlSec;
    int broadcastBatchSize;
    int presenceBatchSize;
    int backpressureLowBytes;
    int backpressureHighBytes;
    int perConnBufferSize;
    int pingInterval;
    int idleTimeout;
    boolean useVirtualThreads;

    public enum StorageMode {
        REDIS,
        MEMORY
    }

    public static BrokerConfig fromEnv() {
        return BrokerConfig.builder()
                .nodeId(getEnv("NODE_ID", "broker-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .storageMode(StorageMode.valueOf(getEnv("STORAGE_MODE", "redis").toUpperCase()))
                .servedLocations(parseList(getEnv("SERVED_LOCATIONS", "local")))
                .publicKeyJwk(getEnv("PUBLIC_KEY_JWK", ""))
                .webhookBaseUrl(getEnv("WEBHOOK_BASE_URL", ""))
                .messageTtlSec(Integer.parseInt(getEnv("MESSAGE_TTL_SEC", String.valueOf(3 * 24 * 60 * 60))))
                .broadcastBatchSize(Integer.parseInt(getEnv("BROADCAST_BATCH_SIZE", "10")))
                .presenceBatchSize(Integer.parseInt(getEnv("PRESENCE_BATCH_SIZE", "50")))
                .backpressureLowBytes(Integer.parseInt(getEnv("BACKPRESSURE_LOW_BYTES", String.valueOf(10 * 1024))))
                .backpressureHighBytes(Integer.parseInt(getEnv("BACKPRESSURE_HIGH_BYTES", String.valueOf(100 * 1024))))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "100")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "10")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .useVirtualThreads(Boolean.parseBoolean(getEnv("USE_VIRTUAL_THREADS", "false")))
                .build();
    }

    public boolean servesLocation(String location) {
        return servedLocations.contains(location);
    }

    public boolean isWebhookEnabled() {
        return webhookBaseUrl != null && !webhookBaseUrl.isBlank();
    }

    private static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
