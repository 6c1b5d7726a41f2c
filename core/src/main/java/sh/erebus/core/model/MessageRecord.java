package sh.erebus.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Buffered message as persisted under {@code msg:{projectId}:{channel}:{topic}:{seq}}.
 */
@Value
public class MessageRecord {
    @JsonProperty("body")
    MessageBody body;

    /**
     * Absolute expiry, epoch millis.
     */
    @JsonProperty("exp")
    long exp;

    @JsonCreator
    public MessageRecord(@JsonProperty("body") MessageBody body, @JsonProperty("exp") long exp) {
        this.body = body;
        this.exp = exp;
    }

    public boolean isExpiredAt(long epochMillis) {
        return exp < epochMillis;
    }
}
