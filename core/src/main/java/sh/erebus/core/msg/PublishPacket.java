package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import sh.erebus.core.model.MessageBody;

/**
 * Client publish. Only {@code payload.payload} and the client correlation fields of the
 * body are kept; routing and identity fields are filled in by the accepting shard.
 */
@Value
public class PublishPacket implements Packet {
    public static final String TYPE = "publish";

    @JsonProperty("requestId")
    String requestId;

    @JsonProperty("topic")
    String topic;

    @JsonProperty("payload")
    MessageBody payload;

    @JsonProperty("clientMsgId")
    String clientMsgId;

    /**
     * When true the sender gets a publish ack (success or error).
     */
    @JsonProperty("ack")
    Boolean ack;

    @JsonCreator
    public PublishPacket(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("topic") String topic,
        @JsonProperty("payload") MessageBody payload,
        @JsonProperty("clientMsgId") String clientMsgId,
        @JsonProperty("ack") Boolean ack
    ) {
        this.requestId = requestId;
        this.topic = topic;
        this.payload = payload;
        this.clientMsgId = clientMsgId;
        this.ack = ack;
    }

    @Override
    public String getPacketType() {
        return TYPE;
    }

    public boolean wantsAck() {
        return Boolean.TRUE.equals(ack);
    }

    @Override
    public boolean isWellFormed() {
        return Packet.optionalNonEmpty(requestId)
            && Packet.nonEmpty(topic)
            && Packet.optionalNonEmpty(clientMsgId)
            && payload != null
            && payload.getPayload() != null;
    }
}
