package sh.erebus.broker.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Optimistic transactions on top of a back end that can compare-and-commit.
 * <p>
 * <b>Protocol:</b>
 * <ol>
 *   <li>Run the body; every key it reads is recorded with the value observed</li>
 *   <li>Hand the read set and the staged writes to {@link #commit}</li>
 *   <li>The back end applies the writes only if every read key still holds the observed value</li>
 *   <li>On conflict, re-run the body from scratch (bounded retries with a short backoff)</li>
 * </ol>
 * </p>
 */
public abstract class AbstractChannelStorage implements IChannelStorage {
    private static final Logger log = LoggerFactory.getLogger(AbstractChannelStorage.class);

    static final int MAX_TRANSACTION_ATTEMPTS = 16;

    /**
     * Atomically applies {@code writes} if every entry of {@code reads} is unchanged.
     *
     * @param reads  key to observed value; null means the key was absent
     * @param writes key to new value; null means delete
     * @return true when committed, false on conflict
     */
    protected abstract Mono<Boolean> commit(Map<String, String> reads, Map<String, String> writes);

    @Override
    public Mono<Void> put(String key, String value) {
        return commit(Collections.emptyMap(), Collections.singletonMap(key, value)).then();
    }

    @Override
    public <T> Mono<T> transaction(Function<StorageTransaction, Mono<T>> body) {
        return Mono.defer(() -> {
                OptimisticTransaction txn = new OptimisticTransaction();
                return body.apply(txn)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(result -> txn.hasWrites()
                        ? commit(txn.readSet(), txn.writeSet()).flatMap(committed -> committed
                            ? Mono.justOrEmpty(result)
                            : Mono.error(new TransactionConflictException()))
                        : Mono.justOrEmpty(result));
            })
            .retryWhen(Retry.backoff(MAX_TRANSACTION_ATTEMPTS - 1, Duration.ofMillis(1))
                .maxBackoff(Duration.ofMillis(20))
                .filter(TransactionConflictException.class::isInstance)
                .doBeforeRetry(signal -> log.debug("Transaction conflict, retry #{}", signal.totalRetries() + 1)))
            .onErrorMap(Exceptions::isRetryExhausted,
                err -> new StorageException("Transaction kept conflicting after "
                    + MAX_TRANSACTION_ATTEMPTS + " attempts", err.getCause()));
    }

    private final class OptimisticTransaction implements StorageTransaction {
        private final Map<String, String> reads = new LinkedHashMap<>();
        private final Map<String, String> writes = new LinkedHashMap<>();

        @Override
        public Mono<String> get(String key) {
            synchronized (this) {
                if (writes.containsKey(key)) {
                    return Mono.justOrEmpty(writes.get(key));
                }
                if (reads.containsKey(key)) {
                    return Mono.justOrEmpty(reads.get(key));
                }
            }
            return AbstractChannelStorage.this.get(key)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(observed -> {
                    synchronized (this) {
                        reads.putIfAbsent(key, observed.orElse(null));
                        return Mono.justOrEmpty(reads.get(key));
                    }
                });
        }

        @Override
        public synchronized void put(String key, String value) {
            writes.put(key, value);
        }

        @Override
        public synchronized void delete(String key) {
            writes.put(key, null);
        }

        synchronized boolean hasWrites() {
            return !writes.isEmpty();
        }

        synchronized Map<String, String> readSet() {
            return new LinkedHashMap<>(reads);
        }

        synchronized Map<String, String> writeSet() {
            return new LinkedHashMap<>(writes);
        }
    }

    static final class TransactionConflictException extends RuntimeException {
        TransactionConflictException() {
            super("Concurrent modification detected", null, false, false);
        }
    }
}
