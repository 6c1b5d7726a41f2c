package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * WebSocket packet envelope, discriminated by {@code packetType}.
 * <p>
 * Client → server: {@code connect}, {@code subscribe}, {@code unsubscribe}, {@code publish}.
 * Server → client: {@code ack}, {@code presence}.
 * </p>
 * <p>
 * Decoding only checks the JSON shape; {@link #isWellFormed()} enforces the
 * field constraints before any business logic sees the packet.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "packetType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ConnectPacket.class, name = ConnectPacket.TYPE),
    @JsonSubTypes.Type(value = SubscribePacket.class, name = SubscribePacket.TYPE),
    @JsonSubTypes.Type(value = UnsubscribePacket.class, name = UnsubscribePacket.TYPE),
    @JsonSubTypes.Type(value = PublishPacket.class, name = PublishPacket.TYPE),
    @JsonSubTypes.Type(value = AckPacket.class, name = AckPacket.TYPE),
    @JsonSubTypes.Type(value = PresencePacket.class, name = PresencePacket.TYPE)
})
public sealed interface Packet
    permits ConnectPacket, SubscribePacket, UnsubscribePacket, PublishPacket, AckPacket, PresencePacket {

    String getPacketType();

    @JsonIgnore
    boolean isWellFormed();

    /**
     * Optional ids must be absent or non-empty.
     */
    static boolean optionalNonEmpty(String value) {
        return value == null || !value.isEmpty();
    }

    static boolean nonEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
