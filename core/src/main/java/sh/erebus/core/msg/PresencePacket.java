package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Server → client notice that a client joined or left a topic.
 */
@Value
@With
public class PresencePacket implements Packet {
    public static final String TYPE = "presence";

    @JsonProperty("clientId")
    String clientId;

    @JsonProperty("topic")
    String topic;

    @JsonProperty("status")
    Status status;

    /**
     * Only set on the copy sent back to the client whose presence changed.
     */
    @JsonProperty("subscribers")
    List<String> subscribers;

    @JsonCreator
    public PresencePacket(
        @JsonProperty("clientId") String clientId,
        @JsonProperty("topic") String topic,
        @JsonProperty("status") Status status,
        @JsonProperty("subscribers") List<String> subscribers
    ) {
        this.clientId = clientId;
        this.topic = topic;
        this.status = status;
        this.subscribers = subscribers;
    }

    public static PresencePacket of(String clientId, String topic, Status status) {
        return new PresencePacket(clientId, topic, status, null);
    }

    @Override
    public String getPacketType() {
        return TYPE;
    }

    @Override
    public boolean isWellFormed() {
        return Packet.nonEmpty(clientId) && Packet.nonEmpty(topic) && status != null;
    }

    public enum Status {
        @JsonProperty("online")
        ONLINE,
        @JsonProperty("offline")
        OFFLINE
    }
}
