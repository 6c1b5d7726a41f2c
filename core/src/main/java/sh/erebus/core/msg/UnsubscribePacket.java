package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class UnsubscribePacket implements Packet {
    public static final String TYPE = "unsubscribe";

    /**
     * Echoed back in the ack when present.
     */
    @JsonProperty("requestId")
    String requestId;

    @JsonProperty("topic")
    String topic;

    @JsonCreator
    public UnsubscribePacket(@JsonProperty("requestId") String requestId, @JsonProperty("topic") String topic) {
        this.requestId = requestId;
        this.topic = topic;
    }

    @Override
    public String getPacketType() {
        return TYPE;
    }

    @Override
    public boolean isWellFormed() {
        return Packet.optionalNonEmpty(requestId) && Packet.nonEmpty(topic);
    }
}
