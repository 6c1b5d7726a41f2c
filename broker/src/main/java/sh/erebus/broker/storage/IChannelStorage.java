package sh.erebus.broker.storage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;

/**
 * Ordered key/value storage private to one channel shard.
 * <p>
 * Single-key operations are atomic. Multi-step read-modify-write sequences must go
 * through {@link #transaction}, which commits all staged writes only if none of the
 * keys read inside it changed in the meantime.
 * </p>
 * <p>
 * Failures surface as {@link StorageException} error signals.
 * </p>
 */
public interface IChannelStorage {

    /**
     * @return the value, or empty when the key is absent
     */
    Mono<String> get(String key);

    Mono<Void> put(String key, String value);

    /**
     * @return whether the key existed
     */
    Mono<Boolean> delete(String key);

    /**
     * Lists entries in key order (descending when {@link ListOptions#isReverse()}).
     */
    Flux<Map.Entry<String, String>> list(ListOptions options);

    /**
     * Runs {@code body} against a transactional view and commits its writes atomically.
     * <p>
     * The body may be re-executed when a conflicting write is detected, so it must not
     * have side effects outside the transaction. Empty results are passed through.
     * </p>
     */
    <T> Mono<T> transaction(Function<StorageTransaction, Mono<T>> body);
}
