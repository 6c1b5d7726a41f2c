package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Fire-and-forget usage accounting record, published to {@link Topics#USAGE}.
 * <p>
 * <b>Wire shape:</b>
 * {@code {"packetType":"usage","payload":{"event":"websocket.message","data":{"projectId":"p","keyId":"k","payloadLength":42}}}}
 * </p>
 * <p>
 * The webhook forwarder posts {@code payload} as-is.
 * </p>
 */
@Value
public class UsageEnvelope {
    public static final String PACKET_TYPE = "usage";

    @JsonProperty("packetType")
    String packetType;

    @JsonProperty("payload")
    Payload payload;

    @JsonCreator
    public UsageEnvelope(@JsonProperty("packetType") String packetType, @JsonProperty("payload") Payload payload) {
        this.packetType = packetType;
        this.payload = payload;
    }

    public static UsageEnvelope of(UsageEvent event, String projectId, String keyId, long payloadLength) {
        return new UsageEnvelope(PACKET_TYPE, new Payload(event, new Data(projectId, keyId, payloadLength)));
    }

    @Value
    public static class Payload {
        @JsonProperty("event")
        UsageEvent event;

        @JsonProperty("data")
        Data data;

        @JsonCreator
        public Payload(@JsonProperty("event") UsageEvent event, @JsonProperty("data") Data data) {
            this.event = event;
            this.data = data;
        }
    }

    @Value
    public static class Data {
        @JsonProperty("projectId")
        String projectId;

        @JsonProperty("keyId")
        String keyId;

        /**
         * Length of the published payload; 0 for connect and subscribe.
         */
        @JsonProperty("payloadLength")
        long payloadLength;

        @JsonCreator
        public Data(
            @JsonProperty("projectId") String projectId,
            @JsonProperty("keyId") String keyId,
            @JsonProperty("payloadLength") long payloadLength
        ) {
            this.projectId = projectId;
            this.keyId = keyId;
            this.payloadLength = payloadLength;
        }
    }
}
