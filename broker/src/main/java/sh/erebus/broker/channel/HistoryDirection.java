package sh.erebus.broker.channel;

import java.util.Locale;

/**
 * Paging direction of a topic history query.
 */
public enum HistoryDirection {
    /**
     * Oldest first, sequences after the cursor.
     */
    FORWARD,
    /**
     * Newest first, sequences before the cursor.
     */
    BACKWARD;

    /**
     * Unknown or missing values read as {@link #BACKWARD}.
     */
    public static HistoryDirection fromParam(String value) {
        if (value != null && FORWARD.name().equals(value.toUpperCase(Locale.ROOT))) {
            return FORWARD;
        }
        return BACKWARD;
    }
}
