package sh.erebus.broker.channel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import sh.erebus.broker.storage.InMemoryChannelStorage;
import sh.erebus.broker.support.TestFixtures;
import sh.erebus.core.key.DistributedKey;

import java.util.List;

import static sh.erebus.broker.support.TestFixtures.CHANNEL;
import static sh.erebus.broker.support.TestFixtures.LOCATION;
import static sh.erebus.broker.support.TestFixtures.PROJECT;
import static sh.erebus.broker.support.TestFixtures.SHARD_KEY;

class ShardManagerTest {

    private static final String WEUR = DistributedKey.forChannelShard(PROJECT, CHANNEL, "weur");
    private static final String APAC = DistributedKey.forChannelShard(PROJECT, CHANNEL, "apac");

    private ShardManager shardManager;

    @BeforeEach
    void setUp() {
        shardManager = new ShardManager(TestFixtures.context(new InMemoryChannelStorage(), TestFixtures.fixedClock()));
        shardManager.setLocationHint(LOCATION).block();
    }

    @Test
    @DisplayName("Should add siblings once each and never add itself")
    void testAddShard() {
        // Given
        StepVerifier.create(shardManager.shouldBroadcastToShards())
                .expectNext(false)
                .verifyComplete();

        // When
        shardManager.addShard(WEUR).block();
        shardManager.addShard(WEUR).block();
        shardManager.addShard(APAC).block();
        shardManager.addShard(SHARD_KEY).block();

        // Then
        StepVerifier.create(shardManager.getAvailableShards())
                .expectNext(List.of(WEUR, APAC))
                .verifyComplete();
        StepVerifier.create(shardManager.shouldBroadcastToShards())
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should remove a known sibling and ignore unknown ones")
    void testRemoveShard() {
        shardManager.setShardsInLocalStorage(List.of(WEUR, APAC)).block();

        shardManager.removeShard(WEUR).block();
        shardManager.removeShard(DistributedKey.forChannelShard(PROJECT, CHANNEL, "enam")).block();

        StepVerifier.create(shardManager.getRemoteShards())
                .expectNext(List.of(APAC))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should forget siblings and location on clear")
    void testClearShards() {
        shardManager.setShardsInLocalStorage(List.of(WEUR)).block();

        shardManager.clearShards().block();

        StepVerifier.create(shardManager.getAvailableShards())
                .expectNext(List.of())
                .verifyComplete();
        StepVerifier.create(shardManager.getLocationHint())
                .verifyComplete();
        StepVerifier.create(shardManager.shouldBroadcastToShards())
                .expectNext(false)
                .verifyComplete();
    }
}
