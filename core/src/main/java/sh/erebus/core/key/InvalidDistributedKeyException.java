package sh.erebus.core.key;

/**
 * Thrown when a distributed key cannot be built or parsed.
 */
public class InvalidDistributedKeyException extends IllegalArgumentException {
    public InvalidDistributedKeyException(String message) {
        super(message);
    }
}
