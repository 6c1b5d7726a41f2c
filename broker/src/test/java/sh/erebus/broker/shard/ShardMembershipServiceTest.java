package sh.erebus.broker.shard;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import sh.erebus.broker.support.RecordingShardRpcService;
import sh.erebus.core.key.DistributedKey;
import sh.erebus.core.msg.ShardRpcCall;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShardMembershipServiceTest {

    private static final String CHANNEL_KEY = DistributedKey.forChannel("proj", "lobby");
    private static final String WNAM = DistributedKey.appendLocationHint(CHANNEL_KEY, "wnam");
    private static final String WEUR = DistributedKey.appendLocationHint(CHANNEL_KEY, "weur");

    private InMemoryShardRegistry registry;
    private RecordingShardRpcService shardRpc;
    private ShardMembershipService membership;

    @BeforeEach
    void setUp() {
        registry = new InMemoryShardRegistry();
        shardRpc = new RecordingShardRpcService();
        membership = new ShardMembershipService(registry, shardRpc);
    }

    @Test
    @DisplayName("Should register the shard and push the full list to every shard")
    void testOnShardConnected() {
        // Given
        membership.onShardConnected("proj", CHANNEL_KEY, "wnam").block();
        shardRpc.getCalls().clear();

        // When
        StepVerifier.create(membership.onShardConnected("proj", CHANNEL_KEY, "weur")).verifyComplete();

        // Then
        List<ShardRpcCall.SetShards> calls = shardRpc.getCalls().stream()
                .map(ShardRpcCall.SetShards.class::cast)
                .collect(Collectors.toList());
        assertEquals(Set.of(WNAM, WEUR), calls.stream().map(ShardRpcCall::getTargetShardKey).collect(Collectors.toSet()));
        calls.forEach(call -> assertEquals(Set.of(WNAM, WEUR), Set.copyOf(call.getShardKeys())));

        StepVerifier.create(registry.getChannelsForProjectId("proj"))
                .expectNext(List.of(CHANNEL_KEY))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should complete normally when a shard cannot be reached")
    void testUnreachableShard() {
        shardRpc.failFor(WNAM);
        membership.onShardConnected("proj", CHANNEL_KEY, "wnam").block();

        StepVerifier.create(membership.onShardConnected("proj", CHANNEL_KEY, "weur")).verifyComplete();

        assertTrue(shardRpc.getCalls().stream().anyMatch(call -> call.getTargetShardKey().equals(WEUR)));
    }

    @Test
    @DisplayName("Should swallow registry failures")
    void testRegistryFailure() {
        IShardRegistry broken = new IShardRegistry() {
            @Override
            public Mono<Boolean> registerChannelAndShard(String projectId, String channelKey, String locationHint) {
                return Mono.error(new IllegalStateException("redis down"));
            }

            @Override
            public Mono<List<String>> getShards(String channelKey) {
                return Mono.just(List.of());
            }

            @Override
            public Mono<List<String>> getChannelsForProjectId(String projectId) {
                return Mono.just(List.of());
            }
        };

        StepVerifier.create(new ShardMembershipService(broken, shardRpc).onShardConnected("proj", CHANNEL_KEY, "wnam"))
                .verifyComplete();
        assertTrue(shardRpc.getCalls().isEmpty());
    }
}
