package sh.erebus.broker.channel;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import sh.erebus.broker.storage.InMemoryChannelStorage;
import sh.erebus.broker.support.FakeWebSocketConnection;
import sh.erebus.broker.support.RecordingUsageReporter;
import sh.erebus.broker.support.TestFixtures;
import sh.erebus.core.model.Access;
import sh.erebus.core.model.MessageBody;
import sh.erebus.core.msg.PresencePacket;
import sh.erebus.core.msg.UsageEvent;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static sh.erebus.broker.support.TestFixtures.CHANNEL;
import static sh.erebus.broker.support.TestFixtures.PROJECT;
import static sh.erebus.broker.support.TestFixtures.connected;
import static sh.erebus.broker.support.TestFixtures.grant;
import static sh.erebus.broker.support.TestFixtures.topic;

class MessageBroadcasterTest {

    private ChannelContext context;
    private MessageBuffer buffer;
    private RecordingUsageReporter usage;
    private MessageBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        context = TestFixtures.context(new InMemoryChannelStorage(), TestFixtures.fixedClock());
        buffer = new MessageBuffer(context);
        usage = new RecordingUsageReporter();
        broadcaster = new MessageBroadcaster(context, BroadcastConfig.from(context.getConfig()),
                buffer, usage, TestFixtures.metrics());
    }

    @Test
    @DisplayName("Should deliver only to readable subscribers other than the sender")
    void testFanOutRules() {
        // Given
        FakeWebSocketConnection sender = add(connected("c-alice", grant("alice", topic("chat", Access.READ_WRITE))));
        FakeWebSocketConnection reader = add(connected("c-bob", grant("bob", topic("chat", Access.READ))));
        FakeWebSocketConnection writeOnly = add(connected("c-carol", grant("carol", topic("chat", Access.WRITE))));
        FakeWebSocketConnection outsider = add(connected("c-erin", grant("erin", topic("chat", Access.READ))));
        FakeWebSocketConnection anonymous = add(new FakeWebSocketConnection("c-anon"));

        // When
        BroadcastStats stats = broadcaster.publishMessage(params("S1", List.of("alice", "bob", "carol"))).block();

        // Then
        assertNotNull(stats);
        assertEquals(1, stats.getSent());
        assertEquals(4, stats.getSkipped());
        assertEquals(1, reader.getSent().size());
        JsonNode delivered = reader.getSentJson().get(0);
        assertEquals("S1", delivered.path("seq").asText());
        assertEquals("hello", delivered.path("payload").asText());
        assertTrue(sender.getSent().isEmpty());
        assertTrue(writeOnly.getSent().isEmpty());
        assertTrue(outsider.getSent().isEmpty());
        assertTrue(anonymous.getSent().isEmpty());
    }

    @Test
    @DisplayName("Should send the informational notice to huh? sockets instead of the message")
    void testHuhScope() {
        FakeWebSocketConnection curious = add(connected("c-dave", grant("dave", topic("chat", Access.HUH))));

        BroadcastStats stats = broadcaster.publishMessage(params("S1", List.of())).block();

        assertEquals(1, stats.getSent());
        assertEquals(List.of(MessageBroadcaster.HUH_NOTICE), curious.getSent());
    }

    @Test
    @DisplayName("Should write once per client when it has several sockets")
    void testDuplicateSockets() {
        FakeWebSocketConnection first = add(connected("c-bob-1", grant("bob", topic("chat", Access.READ))));
        FakeWebSocketConnection second = add(connected("c-bob-2", grant("bob", topic("chat", Access.READ))));

        BroadcastStats stats = broadcaster.publishMessage(params("S1", List.of("bob"))).block();

        assertEquals(1, stats.getSent());
        assertEquals(1, stats.getDuplicate());
        assertEquals(1, first.getSent().size() + second.getSent().size());
    }

    @Test
    @DisplayName("Should skip sockets above the high watermark and closed sockets")
    void testBackpressureAndClosed() {
        FakeWebSocketConnection slow = add(connected("c-frank", grant("frank", topic("chat", Access.READ))));
        slow.setBufferedAmount(context.getConfig().getBackpressureHighBytes() + 1L);
        FakeWebSocketConnection busy = add(connected("c-gina", grant("gina", topic("chat", Access.READ))));
        busy.setBufferedAmount(context.getConfig().getBackpressureLowBytes() + 1L);
        FakeWebSocketConnection gone = add(connected("c-hank", grant("hank", topic("chat", Access.READ))));
        gone.close(1000, "bye");

        BroadcastStats stats = broadcaster.publishMessage(params("S1", List.of("frank", "gina", "hank"))).block();

        assertEquals(1, stats.getHighBackpressure());
        assertEquals(1, stats.getSent());
        assertTrue(slow.getSent().isEmpty());
        assertEquals(1, busy.getSent().size());
    }

    @Test
    @DisplayName("Should buffer the message, advance subscribers' cursors and report usage")
    void testBackgroundTasks() {
        broadcaster.publishMessage(params("S7", List.of("bob", "carol"))).block();

        StepVerifier.create(buffer.getMessagesAfter(PROJECT, CHANNEL, "chat", null).map(List::size))
                .expectNext(1)
                .verifyComplete();
        StepVerifier.create(buffer.getLastSeen(PROJECT, CHANNEL, "chat", "carol"))
                .expectNext("S7")
                .verifyComplete();

        assertEquals(1, usage.getEvents().size());
        RecordingUsageReporter.Reported reported = usage.getEvents().get(0);
        assertEquals(UsageEvent.MESSAGE, reported.getEvent());
        assertEquals("key-1", reported.getKeyId());
        assertEquals("hello".length(), reported.getPayloadLength());
    }

    @Test
    @DisplayName("Should send presence only to subscribers, with the list for the subject")
    void testPresence() {
        FakeWebSocketConnection alice = add(connected("c-alice", grant("alice", topic("chat", Access.READ))));
        FakeWebSocketConnection bob = add(connected("c-bob", grant("bob", topic("chat", Access.READ))));
        FakeWebSocketConnection stranger = add(connected("c-zed", grant("zed", topic("chat", Access.READ))));

        broadcaster.broadcastPresence(PresencePacket.of("alice", "chat", PresencePacket.Status.ONLINE),
                List.of("bob", "alice")).block();

        JsonNode toSelf = alice.getSentJson().get(0);
        JsonNode toOther = bob.getSentJson().get(0);
        assertEquals(2, toSelf.path("subscribers").size());
        assertEquals("online", toOther.path("status").asText());
        assertTrue(toOther.path("subscribers").isMissingNode());
        assertTrue(stranger.getSent().isEmpty());
    }

    private FakeWebSocketConnection add(FakeWebSocketConnection connection) {
        context.addConnection(connection);
        return connection;
    }

    private static PublishMessageParams params(String seq, List<String> subscribers) {
        MessageBody message = MessageBody.builder()
                .id("m-" + seq)
                .topic("chat")
                .senderId("alice")
                .seq(seq)
                .payload("hello")
                .build();
        return PublishMessageParams.builder()
                .message(message)
                .senderId("alice")
                .subscriberIds(subscribers)
                .projectId(PROJECT)
                .keyId("key-1")
                .channel(CHANNEL)
                .topic("chat")
                .seq(seq)
                .build();
    }
}
