package sh.erebus.core.msg;

/**
 * Failure codes reported in a publish ack. Serialized by name.
 */
public enum PublishErrorCode {
    UNAUTHORIZED,
    FORBIDDEN,
    INVALID,
    RATE_LIMITED,
    INTERNAL
}
