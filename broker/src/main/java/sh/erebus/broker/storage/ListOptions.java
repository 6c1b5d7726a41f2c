package sh.erebus.broker.storage;

import lombok.Builder;
import lombok.Value;

/**
 * Range listing parameters. Bounds are exclusive and optional.
 */
@Value
@Builder(toBuilder = true)
public class ListOptions {
    String prefix;
    String startAfter;
    String endBefore;
    @Builder.Default
    int limit = Integer.MAX_VALUE;
    boolean reverse;

    public static ListOptions prefix(String prefix, int limit) {
        return ListOptions.builder().prefix(prefix).limit(limit).build();
    }

    public boolean accepts(String key) {
        return (prefix == null || key.startsWith(prefix))
            && (startAfter == null || key.compareTo(startAfter) > 0)
            && (endBefore == null || key.compareTo(endBefore) < 0);
    }
}
