package sh.erebus.broker.storage;

/**
 * Storage back end failure, including transactions that kept conflicting.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
