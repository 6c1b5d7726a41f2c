package sh.erebus.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.erebus.core.model.MessageBody;
import sh.erebus.core.util.JsonUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Wire format of the WebSocket packets.
 */
class PacketJsonTest {

    // ========== Client → server ==========

    @Test
    @DisplayName("Should decode a subscribe packet by its packetType")
    void testDecodeSubscribe() {
        Packet packet = JsonUtils.readValue(
                "{\"packetType\":\"subscribe\",\"requestId\":\"r1\",\"topic\":\"chat\"}", Packet.class);

        SubscribePacket subscribe = assertInstanceOf(SubscribePacket.class, packet);
        assertEquals("r1", subscribe.getRequestId());
        assertEquals("chat", subscribe.getTopic());
        assertTrue(subscribe.isWellFormed());
    }

    @Test
    @DisplayName("Should decode a publish packet with nested payload")
    void testDecodePublish() {
        String json = "{\"packetType\":\"publish\",\"topic\":\"chat\",\"ack\":true,\"clientMsgId\":\"c-1\","
                + "\"payload\":{\"payload\":\"hello\",\"topic\":\"ignored\"}}";

        PublishPacket publish = assertInstanceOf(PublishPacket.class, JsonUtils.readValue(json, Packet.class));

        assertEquals("hello", publish.getPayload().getPayload());
        assertEquals("c-1", publish.getClientMsgId());
        assertTrue(publish.wantsAck());
        assertTrue(publish.isWellFormed());
    }

    @Test
    @DisplayName("Should reject unknown packet types at decode time")
    void testUnknownPacketType() {
        assertThrows(IllegalArgumentException.class,
                () -> JsonUtils.readValue("{\"packetType\":\"shout\",\"topic\":\"chat\"}", Packet.class));
        assertThrows(IllegalArgumentException.class,
                () -> JsonUtils.readValue("{\"topic\":\"chat\"}", Packet.class));
    }

    @Test
    @DisplayName("Should flag packets with empty or missing required fields")
    void testValidation() {
        assertFalse(new SubscribePacket(null, "").isWellFormed());
        assertFalse(new SubscribePacket("", "chat").isWellFormed());
        assertFalse(new ConnectPacket("").isWellFormed());
        assertFalse(new PublishPacket(null, "chat", null, null, null).isWellFormed());
        assertFalse(new PublishPacket(null, "chat", new MessageBody(), null, null).isWellFormed());
        assertFalse(new UnsubscribePacket(null, null).isWellFormed());
        assertTrue(new UnsubscribePacket(null, "chat").isWellFormed());
    }

    // ========== Server → client ==========

    @Test
    @DisplayName("Should write subscription acks with a nested discriminator")
    void testSubscriptionAckShape() {
        JsonNode node = JsonUtils.mapper().valueToTree(
                AckPacket.subscription("r1", "chat", SubscriptionStatus.SUBSCRIBED));

        assertEquals("ack", node.path("packetType").asText());
        assertEquals("r1", node.path("requestId").asText());
        assertEquals("subscribe", node.path("type").path("type").asText());
        assertEquals("chat", node.path("type").path("topic").asText());
        assertEquals("subscribed", node.path("type").path("status").asText());
    }

    @Test
    @DisplayName("Should write publish results without absent fields")
    void testPublishAckShape() {
        JsonNode ok = JsonUtils.mapper().valueToTree(AckPacket.publishOk("r2", "chat", "m-1", "SEQ", 12.5));
        JsonNode result = ok.path("type").path("result");

        assertTrue(result.path("ok").asBoolean());
        assertEquals("m-1", result.path("serverMsgId").asText());
        assertEquals("SEQ", result.path("seq").asText());
        assertEquals(12.5, result.path("t_ingress").asDouble());
        assertFalse(result.has("code"));

        JsonNode error = JsonUtils.mapper().valueToTree(
                AckPacket.publishError(null, "chat", PublishErrorCode.FORBIDDEN, "nope"));
        JsonNode errorResult = error.path("type").path("result");

        assertFalse(error.has("requestId"));
        assertFalse(errorResult.path("ok").asBoolean());
        assertEquals("FORBIDDEN", errorResult.path("code").asText());
        assertEquals("nope", errorResult.path("message").asText());
        assertFalse(errorResult.has("seq"));
    }

    @Test
    @DisplayName("Should write presence with lowercase status and optional subscribers")
    void testPresenceShape() {
        PresencePacket presence = PresencePacket.of("alice", "chat", PresencePacket.Status.ONLINE);

        JsonNode generic = JsonUtils.mapper().valueToTree(presence);
        JsonNode forSelf = JsonUtils.mapper().valueToTree(presence.withSubscribers(List.of("alice", "bob")));

        assertEquals("presence", generic.path("packetType").asText());
        assertEquals("online", generic.path("status").asText());
        assertFalse(generic.has("subscribers"));
        assertEquals(2, forSelf.path("subscribers").size());
    }

    // ========== Shard RPC and usage ==========

    @Test
    @DisplayName("Should decode shard RPC calls by method name")
    void testShardRpcRoundTrip() {
        ShardRpcCall call = new ShardRpcCall.SetShards("proj:lobby:channel:v1:wnam",
                List.of("proj:lobby:channel:v1:wnam", "proj:lobby:channel:v1:weur"));

        String json = JsonUtils.writeValueAsString(call);
        ShardRpcCall decoded = JsonUtils.readValue(json, ShardRpcCall.class);

        assertTrue(json.contains("\"method\":\"setShardsInLocalStorage\""));
        assertEquals(call, decoded);
    }

    @Test
    @DisplayName("Should write usage events under their dotted names")
    void testUsageEnvelopeShape() {
        JsonNode node = JsonUtils.mapper().valueToTree(UsageEnvelope.of(UsageEvent.MESSAGE, "proj", null, 42));

        assertEquals("usage", node.path("packetType").asText());
        assertEquals("websocket.message", node.path("payload").path("event").asText());
        assertEquals("proj", node.path("payload").path("data").path("projectId").asText());
        assertEquals(42, node.path("payload").path("data").path("payloadLength").asLong());
        assertFalse(node.path("payload").path("data").has("keyId"));
    }
}
