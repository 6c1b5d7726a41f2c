package sh.erebus.broker.channel;

import lombok.Getter;
import lombok.ToString;

/**
 * Per-broadcast counters. Updated from a single sequential pipeline.
 */
@Getter
@ToString
public class BroadcastStats {
    private int sent;
    private int skipped;
    private int duplicate;
    private int errors;
    private int yields;
    private int highBackpressure;

    void record(SendResult result) {
        switch (result) {
            case SENT -> sent++;
            case SKIPPED -> skipped++;
            case HIGH_BACKPRESSURE -> {
                skipped++;
                highBackpressure++;
            }
            case DUPLICATE -> duplicate++;
            case ERROR -> errors++;
            default -> throw new IllegalArgumentException("Unknown send result " + result);
        }
    }

    void recordYield() {
        yields++;
    }
}
