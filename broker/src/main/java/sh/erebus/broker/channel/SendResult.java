package sh.erebus.broker.channel;

/**
 * Outcome of offering one message to one socket.
 */
public enum SendResult {
    SENT,
    SKIPPED,
    /**
     * Skipped because the socket was above the high watermark.
     */
    HIGH_BACKPRESSURE,
    DUPLICATE,
    ERROR
}
