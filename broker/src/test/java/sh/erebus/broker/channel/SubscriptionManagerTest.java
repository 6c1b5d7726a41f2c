package sh.erebus.broker.channel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import sh.erebus.broker.storage.InMemoryChannelStorage;
import sh.erebus.broker.storage.StorageKeys;
import sh.erebus.broker.support.TestFixtures;
import sh.erebus.core.msg.PresencePacket;
import sh.erebus.core.util.JsonUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static sh.erebus.broker.support.TestFixtures.CHANNEL;
import static sh.erebus.broker.support.TestFixtures.PROJECT;

class SubscriptionManagerTest {

    private InMemoryChannelStorage storage;
    private RecordingPresenceListener presence;
    private SubscriptionManager subscriptionManager;

    @BeforeEach
    void setUp() {
        storage = new InMemoryChannelStorage();
        presence = new RecordingPresenceListener();
        subscriptionManager = new SubscriptionManager(
                TestFixtures.context(storage, TestFixtures.fixedClock()), presence);
    }

    @Test
    @DisplayName("Should keep subscribers unique and in arrival order")
    void testSubscribeIdempotent() {
        subscriptionManager.subscribe(PROJECT, CHANNEL, "chat", "alice").block();
        subscriptionManager.subscribe(PROJECT, CHANNEL, "chat", "bob").block();
        subscriptionManager.subscribe(PROJECT, CHANNEL, "chat", "alice").block();

        StepVerifier.create(subscriptionManager.getSubscribers(PROJECT, CHANNEL, "chat"))
                .expectNext(List.of("alice", "bob"))
                .verifyComplete();

        // Presence is announced even for the repeated subscribe
        assertEquals(3, presence.events.size());
        assertEquals(PresencePacket.Status.ONLINE, presence.events.get(2).getStatus());
    }

    @Test
    @DisplayName("Should announce offline presence to the remaining subscribers")
    void testUnsubscribe() {
        subscriptionManager.subscribe(PROJECT, CHANNEL, "chat", "alice").block();
        subscriptionManager.subscribe(PROJECT, CHANNEL, "chat", "bob").block();

        subscriptionManager.unsubscribe(PROJECT, CHANNEL, "chat", "alice").block();

        StepVerifier.create(subscriptionManager.getSubscribers(PROJECT, CHANNEL, "chat"))
                .expectNext(List.of("bob"))
                .verifyComplete();
        PresencePacket last = presence.events.get(presence.events.size() - 1);
        assertEquals("alice", last.getClientId());
        assertEquals(PresencePacket.Status.OFFLINE, last.getStatus());
        assertEquals(List.of("bob"), presence.recipients.get(presence.recipients.size() - 1));
    }

    @Test
    @DisplayName("Should reject a subscriber beyond the per-topic capacity")
    void testCapacity() {
        // Given: a topic already at capacity
        List<String> full = new ArrayList<>();
        for (int i = 0; i < SubscriptionManager.MAX_SUBSCRIBERS_PER_TOPIC; i++) {
            full.add("client-" + i);
        }
        storage.put(StorageKeys.subscribers(PROJECT, CHANNEL, "busy"), JsonUtils.writeValueAsString(full)).block();

        // When / Then
        StepVerifier.create(subscriptionManager.subscribe(PROJECT, CHANNEL, "busy", "late-comer"))
                .expectError(CapacityExceededException.class)
                .verify();
        StepVerifier.create(subscriptionManager.getSubscribers(PROJECT, CHANNEL, "busy").map(List::size))
                .expectNext(SubscriptionManager.MAX_SUBSCRIBERS_PER_TOPIC)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should count a wildcard subscription as subscribed to every topic")
    void testIsSubscribedWildcard() {
        subscriptionManager.subscribe(PROJECT, CHANNEL, "*", "alice").block();

        StepVerifier.create(subscriptionManager.isSubscribed(PROJECT, CHANNEL, "anything", "alice"))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(subscriptionManager.isSubscribed(PROJECT, CHANNEL, "anything", "bob"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should remove a client from all listed topics and report active topics")
    void testBulkUnsubscribeAndStats() {
        subscriptionManager.subscribe(PROJECT, CHANNEL, "a", "alice").block();
        subscriptionManager.subscribe(PROJECT, CHANNEL, "b", "alice").block();
        subscriptionManager.subscribe(PROJECT, CHANNEL, "b", "bob").block();

        StepVerifier.create(subscriptionManager.getTotalSubscriptionCount(PROJECT, CHANNEL))
                .expectNext(3L)
                .verifyComplete();

        subscriptionManager.bulkUnsubscribe("alice", PROJECT, CHANNEL, List.of("a", "b", "never")).block();

        StepVerifier.create(subscriptionManager.getActiveTopics(PROJECT, CHANNEL))
                .expectNext(List.of("b"))
                .verifyComplete();
        StepVerifier.create(subscriptionManager.getSubscriberCounts(PROJECT, CHANNEL, List.of("a", "b")))
                .expectNext(Map.of("a", 0, "b", 1))
                .verifyComplete();
    }

    private static class RecordingPresenceListener implements PresenceListener {
        private final List<PresencePacket> events = new CopyOnWriteArrayList<>();
        private final List<List<String>> recipients = new CopyOnWriteArrayList<>();

        @Override
        public Mono<Void> onPresenceChange(PresencePacket presence, List<String> subscribers) {
            events.add(presence);
            recipients.add(subscribers);
            return Mono.empty();
        }
    }
}
