package sh.erebus.broker.http;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import sh.erebus.broker.auth.GrantVerificationException;
import sh.erebus.broker.auth.IGrantVerifier;
import sh.erebus.broker.channel.ChannelActorRegistry;
import sh.erebus.broker.channel.HistoryDirection;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.broker.ws.WebSocketUpgradeHandler;
import sh.erebus.core.key.DistributedKey;
import sh.erebus.core.key.InvalidDistributedKeyException;
import sh.erebus.core.model.Grant;

import java.util.Optional;

/**
 * {@code GET /v1/pubsub/topics/{topic}/history?grant=&cursor=&limit=&direction=}
 * <p>
 * Reads from the shard at {@code X-Location-Hint}, or the first location this node serves
 * when the header is absent. The grant needs read access to the topic.
 * </p>
 */
public class HistoryHandler {
    private static final Logger log = LoggerFactory.getLogger(HistoryHandler.class);

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;

    private final BrokerConfig config;
    private final IGrantVerifier grantVerifier;
    private final ChannelActorRegistry actorRegistry;

    public HistoryHandler(BrokerConfig config, IGrantVerifier grantVerifier, ChannelActorRegistry actorRegistry) {
        this.config = config;
        this.grantVerifier = grantVerifier;
        this.actorRegistry = actorRegistry;
    }

    public Publisher<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        Optional<String> token = GrantExtractor.extract(req);
        if (token.isEmpty()) {
            return JsonResponses.error(res, HttpResponseStatus.UNAUTHORIZED,
                "Unauthorized: Grant token required in query parameter or X-Erebus-Grant header");
        }

        Grant grant;
        try {
            grant = grantVerifier.verify(token.get());
        } catch (GrantVerificationException e) {
            log.warn("History request with invalid grant: {}", e.getMessage());
            return JsonResponses.error(res, HttpResponseStatus.UNAUTHORIZED, "Unauthorized: Invalid grant token signature");
        }

        String rawTopic = req.param("topic");
        String topic = rawTopic == null ? "" : QueryStringDecoder.decodeComponent(rawTopic);
        if (topic.isEmpty()) {
            return JsonResponses.error(res, HttpResponseStatus.BAD_REQUEST, "Invalid URL path format");
        }
        if (!grant.hasReadAccess(topic)) {
            log.warn("Client {} is not allowed to read history of {}", grant.getUserId(), topic);
            return JsonResponses.error(res, HttpResponseStatus.FORBIDDEN, "Forbidden: no read access to topic");
        }

        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        String cursor = GrantExtractor.firstParam(query, "cursor").orElse(null);
        Optional<String> limitParam = GrantExtractor.firstParam(query, "limit");
        int limit;
        try {
            limit = limitParam.map(Integer::parseInt).orElse(DEFAULT_LIMIT);
        } catch (NumberFormatException e) {
            limit = -1;
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            log.warn("Invalid history limit: {}", limitParam.orElse(""));
            return JsonResponses.error(res, HttpResponseStatus.BAD_REQUEST,
                "Invalid limit: must be between 1 and " + MAX_LIMIT);
        }
        HistoryDirection direction = HistoryDirection.fromParam(
            GrantExtractor.firstParam(query, "direction").orElse(null));

        String locationHint = Optional.ofNullable(req.requestHeaders().get(WebSocketUpgradeHandler.LOCATION_HINT_HEADER))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .orElse(config.getServedLocations().isEmpty() ? null : config.getServedLocations().get(0));
        if (locationHint == null || !config.servesLocation(locationHint)) {
            return JsonResponses.error(res, HttpResponseStatus.MISDIRECTED_REQUEST,
                "Location " + locationHint + " is not served by this node");
        }

        String shardKey;
        try {
            shardKey = DistributedKey.forChannelShard(grant.getProjectId(), grant.getChannel(), locationHint);
        } catch (InvalidDistributedKeyException e) {
            return JsonResponses.error(res, HttpResponseStatus.BAD_REQUEST, e.getMessage());
        }

        int pageSize = limit;
        log.debug("History of {} on {} (cursor={}, limit={}, direction={})", topic, shardKey, cursor, pageSize, direction);

        return actorRegistry.get(shardKey)
            .getTopicHistory(grant.getProjectId(), grant.getChannel(), topic, cursor, pageSize, direction)
            .flatMap(page -> Mono.from(JsonResponses.ok(res, page)))
            .onErrorResume(err -> {
                log.error("Failed to read history of {} on {}", topic, shardKey, err);
                return Mono.from(JsonResponses.error(res, HttpResponseStatus.INTERNAL_SERVER_ERROR,
                    "Internal Server Error: Failed to fetch history"));
            });
    }
}
