package sh.erebus.broker.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InMemoryChannelStorageTest {

    private InMemoryChannelStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryChannelStorage();
    }

    @Test
    @DisplayName("Should list prefixed keys in order, both directions, honoring bounds")
    void testList() {
        Flux.just("msg:a:1", "msg:a:2", "msg:a:3", "msg:b:1", "other")
                .concatMap(key -> storage.put(key, key.toUpperCase()))
                .blockLast();

        StepVerifier.create(keys(ListOptions.builder().prefix("msg:a:").build()))
                .expectNext(List.of("msg:a:1", "msg:a:2", "msg:a:3"))
                .verifyComplete();

        StepVerifier.create(keys(ListOptions.builder().prefix("msg:a:").reverse(true).limit(2).build()))
                .expectNext(List.of("msg:a:3", "msg:a:2"))
                .verifyComplete();

        StepVerifier.create(keys(ListOptions.builder().prefix("msg:a:").startAfter("msg:a:1").build()))
                .expectNext(List.of("msg:a:2", "msg:a:3"))
                .verifyComplete();

        StepVerifier.create(keys(ListOptions.builder().prefix("msg:a:").reverse(true).endBefore("msg:a:3").build()))
                .expectNext(List.of("msg:a:2", "msg:a:1"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report whether delete removed anything")
    void testDelete() {
        storage.put("k", "v").block();

        StepVerifier.create(storage.delete("k")).expectNext(true).verifyComplete();
        StepVerifier.create(storage.delete("k")).expectNext(false).verifyComplete();
        StepVerifier.create(storage.get("k")).verifyComplete();
    }

    @Test
    @DisplayName("Should see its own staged writes and commit them together")
    void testTransactionReadsOwnWrites() {
        Mono<String> result = storage.transaction(txn -> {
            txn.put("a", "1");
            txn.delete("b");
            return txn.get("a");
        });
        storage.put("b", "gone").block();

        StepVerifier.create(result).expectNext("1").verifyComplete();
        StepVerifier.create(storage.get("a")).expectNext("1").verifyComplete();
        StepVerifier.create(storage.get("b")).verifyComplete();
    }

    @Test
    @DisplayName("Should re-run the body when a read key changed before commit")
    void testTransactionConflictRetries() {
        // Given
        storage.put("counter", "0").block();
        AtomicInteger attempts = new AtomicInteger();

        // When: the first attempt is overtaken by an outside write
        Mono<String> increment = storage.transaction(txn -> txn.get("counter")
                .flatMap(value -> {
                    Mono<Void> interference = attempts.getAndIncrement() == 0
                            ? storage.put("counter", "10")
                            : Mono.empty();
                    return interference.then(Mono.fromCallable(() -> {
                        String next = String.valueOf(Integer.parseInt(value) + 1);
                        txn.put("counter", next);
                        return next;
                    }));
                }));

        // Then
        StepVerifier.create(increment).expectNext("11").verifyComplete();
        assertEquals(2, attempts.get());
        StepVerifier.create(storage.get("counter")).expectNext("11").verifyComplete();
    }

    @Test
    @DisplayName("Should not lose increments under concurrent transactions")
    void testConcurrentTransactions() {
        storage.put("counter", "0").block();

        Flux.range(0, 8)
                .flatMap(i -> storage.transaction(txn -> txn.get("counter")
                                .map(value -> {
                                    String next = String.valueOf(Integer.parseInt(value) + 1);
                                    txn.put("counter", next);
                                    return next;
                                }))
                        .subscribeOn(Schedulers.parallel()))
                .blockLast();

        StepVerifier.create(storage.get("counter")).expectNext("8").verifyComplete();
    }

    @Test
    @DisplayName("Should give up with StorageException when conflicts never stop")
    void testTransactionGivesUp() {
        storage.put("hot", "0").block();
        AtomicInteger writes = new AtomicInteger();

        Mono<String> doomed = storage.transaction(txn -> txn.get("hot")
                .flatMap(value -> storage.put("hot", String.valueOf(writes.incrementAndGet()))
                        .thenReturn(value))
                .doOnNext(value -> txn.put("hot", "mine")));

        StepVerifier.create(doomed)
                .expectError(StorageException.class)
                .verify();
        assertEquals(AbstractChannelStorage.MAX_TRANSACTION_ATTEMPTS, writes.get());
    }

    private Mono<List<String>> keys(ListOptions options) {
        return storage.list(options).map(Map.Entry::getKey).collect(Collectors.toList());
    }
}
