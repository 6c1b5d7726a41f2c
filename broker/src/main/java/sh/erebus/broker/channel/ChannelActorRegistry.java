package sh.erebus.broker.channel;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import sh.erebus.broker.auth.IGrantVerifier;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.broker.metrics.MetricsService;
import sh.erebus.broker.shard.IShardRpcService;
import sh.erebus.broker.shard.ShardRpcDispatcher;
import sh.erebus.broker.storage.IChannelStorageFactory;
import sh.erebus.broker.usage.IUsageReporter;
import sh.erebus.core.key.DistributedKey;
import sh.erebus.core.msg.ShardRpcCall;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Looks up the actor of a shard key, creating it on first use.
 * <p>
 * All actors share one worker pool; each gets its own sequential view of it, so an actor
 * never runs on two threads at once while different actors run in parallel.
 * </p>
 */
public class ChannelActorRegistry implements ShardRpcDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ChannelActorRegistry.class);

    private final BrokerConfig config;
    private final IChannelStorageFactory storageFactory;
    private final IGrantVerifier grantVerifier;
    private final IUsageReporter usageReporter;
    private final IShardRpcService shardRpcService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final ExecutorService actorPool;

    private final Map<String, ChannelActor> actors = new ConcurrentHashMap<>();

    public ChannelActorRegistry(BrokerConfig config, IChannelStorageFactory storageFactory,
                                IGrantVerifier grantVerifier, IUsageReporter usageReporter,
                                IShardRpcService shardRpcService, MetricsService metricsService, Clock clock) {
        this.config = config;
        this.storageFactory = storageFactory;
        this.grantVerifier = grantVerifier;
        this.usageReporter = usageReporter;
        this.shardRpcService = shardRpcService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.actorPool = Executors.newFixedThreadPool(
            Runtime.getRuntime().availableProcessors(),
            new ThreadFactoryBuilder().setNameFormat("channel-actor-%d").setDaemon(true).build());

        metricsService.bindActorCount(actors::size);
    }

    /**
     * @param shardKey 5-segment shard key
     */
    public ChannelActor get(String shardKey) {
        return actors.computeIfAbsent(shardKey, this::create);
    }

    private ChannelActor create(String shardKey) {
        if (DistributedKey.locationOf(shardKey).isEmpty()) {
            throw new IllegalArgumentException("Not a shard key: " + shardKey);
        }
        ChannelContext context = new ChannelContext(
            shardKey,
            storageFactory.forShard(shardKey),
            config,
            clock,
            Schedulers.fromExecutor(MoreExecutors.newSequentialExecutor(actorPool))
        );
        log.info("Created channel actor for {}", shardKey);
        return new ChannelActor(context, grantVerifier, usageReporter, shardRpcService, metricsService);
    }

    public int size() {
        return actors.size();
    }

    @Override
    public Mono<Void> dispatch(ShardRpcCall call) {
        return Mono.defer(() -> {
            ChannelActor actor = get(call.getTargetShardKey());
            if (call instanceof ShardRpcCall.PublishMessage) {
                ShardRpcCall.PublishMessage publish = (ShardRpcCall.PublishMessage) call;
                return actor.publishMessage(PublishMessageParams.builder()
                        .message(publish.getMessage())
                        .senderId(publish.getSenderId())
                        .subscriberIds(publish.getSubscriberIds())
                        .projectId(publish.getProjectId())
                        .keyId(publish.getKeyId())
                        .channel(publish.getChannel())
                        .topic(publish.getTopic())
                        .seq(publish.getSeq())
                        .build())
                    .then();
            }
            if (call instanceof ShardRpcCall.SetShards) {
                return actor.setShardsInLocalStorage(((ShardRpcCall.SetShards) call).getShardKeys());
            }
            return Mono.error(new IllegalArgumentException("Unknown shard RPC method: " + call.getMethod()));
        });
    }

    public void close() {
        actorPool.shutdown();
        try {
            if (!actorPool.awaitTermination(10, TimeUnit.SECONDS)) {
                actorPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            actorPool.shutdownNow();
        }
    }
}
