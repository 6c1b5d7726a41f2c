package sh.erebus.broker.channel;

import lombok.Builder;
import lombok.Value;
import sh.erebus.broker.config.BrokerConfig;

/**
 * Fan-out tuning.
 */
@Value
@Builder(toBuilder = true)
public class BroadcastConfig {
    @Builder.Default
    int batchSize = 10;
    @Builder.Default
    int presenceBatchSize = 50;
    /**
     * Above this many buffered bytes a send first yields the actor.
     */
    @Builder.Default
    long backpressureLowBytes = 10 * 1024;
    /**
     * Above this many buffered bytes a send is skipped.
     */
    @Builder.Default
    long backpressureHighBytes = 100 * 1024;

    public static BroadcastConfig from(BrokerConfig config) {
        return BroadcastConfig.builder()
            .batchSize(config.getBroadcastBatchSize())
            .presenceBatchSize(config.getPresenceBatchSize())
            .backpressureLowBytes(config.getBackpressureLowBytes())
            .backpressureHighBytes(config.getBackpressureHighBytes())
            .build();
    }
}
