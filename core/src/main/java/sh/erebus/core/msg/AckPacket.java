package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Value;

/**
 * Server → client acknowledgement. The nested {@code type} object is itself
 * discriminated by its {@code type} field.
 * <p>
 * Wire shapes:
 * <pre>
 * {"packetType":"ack","requestId":"r1","type":{"type":"subscribe","topic":"t","status":"subscribed"}}
 * {"packetType":"ack","requestId":"r2","type":{"type":"publish","topic":"t",
 *     "result":{"ok":true,"serverMsgId":"...","seq":"...","t_ingress":12.5}}}
 * {"packetType":"ack","requestId":"r3","type":{"type":"publish","topic":"t",
 *     "result":{"ok":false,"code":"FORBIDDEN","message":"..."}}}
 * </pre>
 * </p>
 */
@Value
public class AckPacket implements Packet {
    public static final String TYPE = "ack";

    @JsonProperty("requestId")
    String requestId;

    @JsonProperty("type")
    Body type;

    @JsonCreator
    public AckPacket(@JsonProperty("requestId") String requestId, @JsonProperty("type") Body type) {
        this.requestId = requestId;
        this.type = type;
    }

    public static AckPacket subscription(String requestId, String topic, SubscriptionStatus status) {
        return new AckPacket(requestId, new SubscribeAck(topic, status));
    }

    public static AckPacket publishOk(String requestId, String topic, String serverMsgId, String seq, double tIngress) {
        return new AckPacket(requestId, new PublishAck(topic, PublishResult.ok(serverMsgId, seq, tIngress)));
    }

    public static AckPacket publishError(String requestId, String topic, PublishErrorCode code, String message) {
        return new AckPacket(requestId, new PublishAck(topic, PublishResult.error(code, message)));
    }

    @Override
    public String getPacketType() {
        return TYPE;
    }

    @Override
    public boolean isWellFormed() {
        return Packet.optionalNonEmpty(requestId) && type != null;
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = SubscribeAck.class, name = SubscribeAck.TYPE),
        @JsonSubTypes.Type(value = PublishAck.class, name = PublishAck.TYPE)
    })
    public sealed interface Body permits SubscribeAck, PublishAck {
        String getType();

        String getTopic();
    }

    @Value
    public static class SubscribeAck implements Body {
        public static final String TYPE = "subscribe";

        @JsonProperty("topic")
        String topic;

        @JsonProperty("status")
        SubscriptionStatus status;

        @JsonCreator
        public SubscribeAck(@JsonProperty("topic") String topic, @JsonProperty("status") SubscriptionStatus status) {
            this.topic = topic;
            this.status = status;
        }

        @Override
        public String getType() {
            return TYPE;
        }
    }

    @Value
    public static class PublishAck implements Body {
        public static final String TYPE = "publish";

        @JsonProperty("topic")
        String topic;

        @JsonProperty("result")
        PublishResult result;

        @JsonCreator
        public PublishAck(@JsonProperty("topic") String topic, @JsonProperty("result") PublishResult result) {
            this.topic = topic;
            this.result = result;
        }

        @Override
        public String getType() {
            return TYPE;
        }
    }

    /**
     * Success carries {@code serverMsgId}, {@code seq}, {@code t_ingress}; failure carries {@code code}, {@code message}.
     */
    @Value
    public static class PublishResult {
        @JsonProperty("ok")
        boolean ok;

        @JsonProperty("serverMsgId")
        String serverMsgId;

        @JsonProperty("seq")
        String seq;

        @JsonProperty("t_ingress")
        Double timeIngress;

        @JsonProperty("code")
        PublishErrorCode code;

        @JsonProperty("message")
        String message;

        @JsonCreator
        public PublishResult(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("serverMsgId") String serverMsgId,
            @JsonProperty("seq") String seq,
            @JsonProperty("t_ingress") Double timeIngress,
            @JsonProperty("code") PublishErrorCode code,
            @JsonProperty("message") String message
        ) {
            this.ok = ok;
            this.serverMsgId = serverMsgId;
            this.seq = seq;
            this.timeIngress = timeIngress;
            this.code = code;
            this.message = message;
        }

        public static PublishResult ok(String serverMsgId, String seq, double tIngress) {
            return new PublishResult(true, serverMsgId, seq, tIngress, null, null);
        }

        public static PublishResult error(PublishErrorCode code, String message) {
            return new PublishResult(false, null, null, null, code, message);
        }
    }
}
