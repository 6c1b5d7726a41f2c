package sh.erebus.broker.storage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed shard storage for single-node deployments and tests.
 */
public class InMemoryChannelStorage extends AbstractChannelStorage {
    private final ConcurrentSkipListMap<String, String> data = new ConcurrentSkipListMap<>();

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> data.get(key));
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromCallable(() -> {
            synchronized (data) {
                return data.remove(key) != null;
            }
        });
    }

    @Override
    public Flux<Map.Entry<String, String>> list(ListOptions options) {
        return Flux.defer(() -> {
            NavigableMap<String, String> view = data;
            if (options.getPrefix() != null) {
                view = view.subMap(options.getPrefix(), true, options.getPrefix() + Character.MAX_VALUE, false);
            }
            if (options.isReverse()) {
                view = view.descendingMap();
            }
            return Flux.fromStream(view.entrySet().stream()
                .filter(e -> options.accepts(e.getKey()))
                .limit(options.getLimit())
                .map(e -> Map.entry(e.getKey(), e.getValue())));
        });
    }

    @Override
    protected Mono<Boolean> commit(Map<String, String> reads, Map<String, String> writes) {
        return Mono.fromCallable(() -> {
            synchronized (data) {
                for (Map.Entry<String, String> read : reads.entrySet()) {
                    if (!Objects.equals(data.get(read.getKey()), read.getValue())) {
                        return false;
                    }
                }
                writes.forEach((key, value) -> {
                    if (value == null) {
                        data.remove(key);
                    } else {
                        data.put(key, value);
                    }
                });
                return true;
            }
        });
    }

    public int size() {
        return data.size();
    }
}
