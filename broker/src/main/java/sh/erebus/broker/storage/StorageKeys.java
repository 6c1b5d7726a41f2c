package sh.erebus.broker.storage;

/**
 * Keyspace of one channel shard's storage.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Every topic-scoped key starts with a type prefix and {@code projectId:channel:topic}</li>
 *   <li>Message keys end with the ULID sequence, so prefix listing returns chronological order</li>
 *   <li>Shard-level scalars use fixed names</li>
 * </ul>
 * </p>
 */
public final class StorageKeys {
    private StorageKeys() {
    }

    /**
     * Known sibling shards of this channel (JSON array of 5-segment keys, self excluded).
     */
    public static final String AVAILABLE_SHARDS = "availableShards";

    /**
     * This shard's own location (plain string).
     */
    public static final String LOCATION_HINT = "locationHint";

    /**
     * Subscriber list: {@code subs:{projectId}:{channel}:{topic}}
     * <p>
     * <b>Content:</b> JSON array of clientIds, insertion-ordered, no duplicates.
     * </p>
     */
    public static String subscribers(String projectId, String channel, String topic) {
        return "subs:" + projectId + ":" + channel + ":" + topic;
    }

    /**
     * Buffered message: {@code msg:{projectId}:{channel}:{topic}:{seq}}
     * <p>
     * <b>Content:</b> JSON {@code {body, exp}}.
     * </p>
     */
    public static String message(String projectId, String channel, String topic, String seq) {
        return messagePrefix(projectId, channel, topic) + seq;
    }

    public static String messagePrefix(String projectId, String channel, String topic) {
        return "msg:" + projectId + ":" + channel + ":" + topic + ":";
    }

    /**
     * Last issued sequence: {@code seq:{projectId}:{channel}:{topic}}
     */
    public static String sequence(String projectId, String channel, String topic) {
        return "seq:" + projectId + ":" + channel + ":" + topic;
    }

    /**
     * Last sequence a client is entitled to have seen:
     * {@code last_seq_seen:{projectId}:{channel}:{topic}:{clientId}}
     */
    public static String lastSeen(String projectId, String channel, String topic, String clientId) {
        return "last_seq_seen:" + projectId + ":" + channel + ":" + topic + ":" + clientId;
    }

    public static String subscribersPrefix(String projectId, String channel) {
        return "subs:" + projectId + ":" + channel + ":";
    }
}
