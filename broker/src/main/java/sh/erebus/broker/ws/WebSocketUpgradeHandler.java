package sh.erebus.broker.ws;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import sh.erebus.broker.auth.GrantVerificationException;
import sh.erebus.broker.auth.IGrantVerifier;
import sh.erebus.broker.channel.ChannelActor;
import sh.erebus.broker.channel.ChannelActorRegistry;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.broker.http.GrantExtractor;
import sh.erebus.broker.http.JsonResponses;
import sh.erebus.broker.shard.ShardMembershipService;
import sh.erebus.core.key.DistributedKey;
import sh.erebus.core.key.InvalidDistributedKeyException;
import sh.erebus.core.model.Grant;

import java.util.Optional;

/**
 * Routes {@code GET /v1/pubsub} to the channel shard named by the grant and the location hint.
 * <p>
 * The grant is only used here to pick the shard; the socket still has to send a
 * {@code connect} packet before it may subscribe or publish.
 * </p>
 * <p>
 * <b>Responses before the upgrade:</b>
 * <ul>
 *   <li>400: missing {@code X-Location-Hint}, unusable key segments, not a WebSocket handshake</li>
 *   <li>401: missing or invalid grant</li>
 *   <li>421: the location is not served by this node</li>
 * </ul>
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    public static final String LOCATION_HINT_HEADER = "X-Location-Hint";

    private final BrokerConfig config;
    private final IGrantVerifier grantVerifier;
    private final ChannelActorRegistry actorRegistry;
    private final ShardMembershipService membershipService;
    private final WebSocketHandler wsHandler;

    public WebSocketUpgradeHandler(BrokerConfig config, IGrantVerifier grantVerifier,
                                   ChannelActorRegistry actorRegistry, ShardMembershipService membershipService) {
        this.config = config;
        this.grantVerifier = grantVerifier;
        this.actorRegistry = actorRegistry;
        this.membershipService = membershipService;
        this.wsHandler = new WebSocketHandler(config);
    }

    public Publisher<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        String locationHint = Optional.ofNullable(req.requestHeaders().get(LOCATION_HINT_HEADER))
            .map(String::trim)
            .orElse("");
        if (locationHint.isEmpty()) {
            log.warn("Rejecting upgrade without {}", LOCATION_HINT_HEADER);
            return JsonResponses.error(res, HttpResponseStatus.BAD_REQUEST, "Location hint is required");
        }

        Optional<String> token = GrantExtractor.extract(req);
        if (token.isEmpty()) {
            return JsonResponses.error(res, HttpResponseStatus.UNAUTHORIZED,
                "Unauthorized: Grant token required in query parameter or X-Erebus-Grant header");
        }

        Grant grant;
        try {
            grant = grantVerifier.verify(token.get());
        } catch (GrantVerificationException e) {
            log.warn("Rejecting upgrade with invalid grant: {}", e.getMessage());
            return JsonResponses.error(res, HttpResponseStatus.UNAUTHORIZED, "Unauthorized: Invalid grant token signature");
        }

        if (!config.servesLocation(locationHint)) {
            log.warn("Rejecting upgrade for location {} (served: {})", locationHint, config.getServedLocations());
            return JsonResponses.error(res, HttpResponseStatus.MISDIRECTED_REQUEST,
                "Location " + locationHint + " is not served by this node");
        }

        String channelKey;
        String shardKey;
        try {
            channelKey = DistributedKey.forChannel(grant.getProjectId(), grant.getChannel());
            shardKey = DistributedKey.appendLocationHint(channelKey, locationHint);
        } catch (InvalidDistributedKeyException e) {
            log.warn("Rejecting upgrade: {}", e.getMessage());
            return JsonResponses.error(res, HttpResponseStatus.BAD_REQUEST, e.getMessage());
        }

        if (!"websocket".equalsIgnoreCase(req.requestHeaders().get(HttpHeaderNames.UPGRADE))) {
            return JsonResponses.error(res, HttpResponseStatus.BAD_REQUEST, "Expected a WebSocket upgrade");
        }

        try (MDC.MDCCloseable ignored = MDC.putCloseable("shardKey", shardKey)) {
            log.debug("Upgrading connection of {} to shard {}", grant.getUserId(), shardKey);
        }

        ChannelActor actor = actorRegistry.get(shardKey);
        membershipService.onShardConnected(grant.getProjectId(), channelKey, locationHint).subscribe();

        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, actor, locationHint));
    }
}
