package sh.erebus.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A published message as stored, replicated and delivered to subscribers.
 * <p>
 * <b>Identity:</b> {@code id} and {@code seq} are assigned once by the shard that
 * accepted the publish and copied verbatim to every sibling shard, so a given
 * message is the same record in every region's buffer.
 * </p>
 * <p>
 * <b>Instrumentation:</b> the {@code t_*} fields are monotonic milliseconds on the
 * accepting node and are filled in as the message crosses pipeline stages.
 * They are only comparable with each other, never with {@code sentAt}.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MessageBody {
    /**
     * Server-assigned unique id.
     */
    @JsonProperty("id")
    String id;

    /**
     * Topic as routed by the broker; whatever the client put here is overwritten.
     */
    @JsonProperty("topic")
    String topic;

    /**
     * userId of the publishing grant.
     */
    @JsonProperty("senderId")
    String senderId;

    /**
     * Per-topic ULID sequence.
     */
    @JsonProperty("seq")
    String seq;

    /**
     * Wall-clock ingress time on the accepting shard. Set once, never overwritten.
     */
    @JsonProperty("sentAt")
    Instant sentAt;

    /**
     * Opaque application payload.
     */
    @JsonProperty("payload")
    String payload;

    @JsonProperty("clientMsgId")
    String clientMsgId;

    @JsonProperty("clientPublishTs")
    Long clientPublishTs;

    @JsonProperty("t_ingress")
    Double timeIngress;

    @JsonProperty("t_enqueued")
    Double timeEnqueued;

    @JsonProperty("t_broadcast_begin")
    Double timeBroadcastBegin;

    @JsonProperty("t_ws_write_end")
    Double timeWsWriteEnd;

    @JsonProperty("t_broadcast_end")
    Double timeBroadcastEnd;
}
