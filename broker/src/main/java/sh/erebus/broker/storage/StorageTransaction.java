package sh.erebus.broker.storage;

import reactor.core.publisher.Mono;

/**
 * Transactional view handed to {@link IChannelStorage#transaction}.
 * <p>
 * Reads see the transaction's own staged writes. Writes are buffered until commit.
 * </p>
 */
public interface StorageTransaction {

    Mono<String> get(String key);

    void put(String key, String value);

    void delete(String key);
}
