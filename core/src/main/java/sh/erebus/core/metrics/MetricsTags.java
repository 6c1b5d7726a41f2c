package sh.erebus.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for a variant (packet type, RPC transport).
     */
    public static final String TYPE = "type";

    /**
     * Tag key for outcome (sent/skipped/ok/error).
     */
    public static final String RESULT = "result";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";
}
