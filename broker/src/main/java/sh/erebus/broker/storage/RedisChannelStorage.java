package sh.erebus.broker.storage;

import io.lettuce.core.KeyValue;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis-backed shard storage.
 * <p>
 * <b>Layout</b> (per shard, {@code ns = "erebus:shard:{shardKey}:"}):
 * <ul>
 *   <li>{@code ns + key}: String value</li>
 *   <li>{@code ns + "__index"}: Sorted set of all keys, score 0, for lexicographic range listing</li>
 * </ul>
 * </p>
 * <p>
 * Writes always go through {@link #COMMIT_SCRIPT} so the value and the index move together,
 * and so that transactions can compare-and-commit in one round trip.
 * </p>
 */
public class RedisChannelStorage extends AbstractChannelStorage {
    private static final Logger log = LoggerFactory.getLogger(RedisChannelStorage.class);

    /**
     * KEYS[1] index. ARGV: ns, readCount, (key, present 0/1, value)*, writeCount, (key, S/D, value)*.
     */
    static final String COMMIT_SCRIPT = String.join("\n",
        "local ns = ARGV[1]",
        "local n = tonumber(ARGV[2])",
        "local i = 3",
        "for _ = 1, n do",
        "  local current = redis.call('GET', ns .. ARGV[i])",
        "  if ARGV[i + 1] == '0' then",
        "    if current then return 0 end",
        "  elseif current ~= ARGV[i + 2] then",
        "    return 0",
        "  end",
        "  i = i + 3",
        "end",
        "local m = tonumber(ARGV[i])",
        "i = i + 1",
        "for _ = 1, m do",
        "  if ARGV[i + 1] == 'S' then",
        "    redis.call('SET', ns .. ARGV[i], ARGV[i + 2])",
        "    redis.call('ZADD', KEYS[1], 0, ARGV[i])",
        "  else",
        "    redis.call('DEL', ns .. ARGV[i])",
        "    redis.call('ZREM', KEYS[1], ARGV[i])",
        "  end",
        "  i = i + 3",
        "end",
        "return 1"
    );

    private static final String UPPER_SENTINEL = "\uFFFF";

    private final RedisReactiveCommands<String, String> commands;
    private final String shardKey;
    private final String namespace;
    private final String indexKey;

    public RedisChannelStorage(RedisReactiveCommands<String, String> commands, String shardKey) {
        this.commands = commands;
        this.shardKey = shardKey;
        this.namespace = "erebus:shard:" + shardKey + ":";
        this.indexKey = namespace + "__index";
    }

    @Override
    public Mono<String> get(String key) {
        return commands.get(namespace + key)
            .onErrorMap(err -> new StorageException("GET failed for " + key + " in " + shardKey, err));
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return get(key)
            .flatMap(existing -> commit(Map.of(), deletion(key)).thenReturn(true))
            .defaultIfEmpty(false);
    }

    @Override
    public Flux<Map.Entry<String, String>> list(ListOptions options) {
        Range<String> range = Range.from(lowerBound(options), upperBound(options));
        Limit limit = options.getLimit() == Integer.MAX_VALUE ? Limit.unlimited() : Limit.create(0, options.getLimit());

        Flux<String> keys = options.isReverse()
            ? commands.zrevrangebylex(indexKey, range, limit)
            : commands.zrangebylex(indexKey, range, limit);

        return keys
            .filter(options::accepts)
            .collectList()
            .flatMapMany(this::fetchValues)
            .onErrorMap(err -> !(err instanceof StorageException),
                err -> new StorageException("LIST failed for " + options.getPrefix() + " in " + shardKey, err));
    }

    @Override
    protected Mono<Boolean> commit(Map<String, String> reads, Map<String, String> writes) {
        List<String> args = new ArrayList<>(2 + reads.size() * 3 + 1 + writes.size() * 3);
        args.add(namespace);
        args.add(String.valueOf(reads.size()));
        reads.forEach((key, value) -> {
            args.add(key);
            args.add(value == null ? "0" : "1");
            args.add(value == null ? "" : value);
        });
        args.add(String.valueOf(writes.size()));
        writes.forEach((key, value) -> {
            args.add(key);
            args.add(value == null ? "D" : "S");
            args.add(value == null ? "" : value);
        });

        return commands.<Long>eval(COMMIT_SCRIPT, ScriptOutputType.INTEGER, new String[]{indexKey},
                args.toArray(new String[0]))
            .next()
            .map(result -> result == 1L)
            .doOnError(err -> log.error("Commit failed for shard {}", shardKey, err))
            .onErrorMap(err -> new StorageException("Commit failed in " + shardKey, err));
    }

    private Flux<Map.Entry<String, String>> fetchValues(List<String> keys) {
        if (keys.isEmpty()) {
            return Flux.empty();
        }
        String[] namespaced = keys.stream().map(k -> namespace + k).toArray(String[]::new);
        return commands.mget(namespaced)
            .filter(KeyValue::hasValue)
            .map(kv -> Map.entry(kv.getKey().substring(namespace.length()), kv.getValue()));
    }

    private static Map<String, String> deletion(String key) {
        Map<String, String> writes = new HashMap<>();
        writes.put(key, null);
        return writes;
    }

    private static Range.Boundary<String> lowerBound(ListOptions options) {
        String prefix = options.getPrefix();
        String startAfter = options.getStartAfter();
        if (startAfter != null && (prefix == null || startAfter.compareTo(prefix) >= 0)) {
            return Range.Boundary.excluding(startAfter);
        }
        return prefix == null ? Range.Boundary.unbounded() : Range.Boundary.including(prefix);
    }

    private static Range.Boundary<String> upperBound(ListOptions options) {
        String prefix = options.getPrefix();
        String endBefore = options.getEndBefore();
        if (endBefore != null && (prefix == null || endBefore.compareTo(prefix + UPPER_SENTINEL) < 0)) {
            return Range.Boundary.excluding(endBefore);
        }
        return prefix == null ? Range.Boundary.unbounded() : Range.Boundary.excluding(prefix + UPPER_SENTINEL);
    }
}
