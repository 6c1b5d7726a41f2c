package sh.erebus.broker.ws;

import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;
import sh.erebus.broker.channel.ChannelActor;
import sh.erebus.broker.config.BrokerConfig;

/**
 * Lifecycle of one upgraded socket: hands it to its channel actor, pumps inbound text
 * frames into the actor in arrival order and tells the actor when the socket goes away.
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final BrokerConfig config;

    public WebSocketHandler(BrokerConfig config) {
        this.config = config;
    }

    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound,
                                  ChannelActor actor, String locationHint) {
        NettyWebSocketConnection connection = NettyWebSocketConnection.create(inbound, outbound);
        log.debug("WebSocket {} opened on {}", connection.getId(), actor.getShardKey());

        handleConnectionStateUpdates(inbound, connection, actor);

        return actor.accept(locationHint, connection)
            .then(Mono.when(
                outbound.sendString(connection.outboundFlux()).then(),
                handleInboundMessages(inbound, connection, actor)
            ))
            .onErrorResume(err -> {
                log.error("WebSocket error on connection {}", connection.getId(), err);
                return outbound.sendClose(CloseCodes.INTERNAL_SERVER_ERROR, "Internal error");
            });
    }

    private void handleConnectionStateUpdates(WebsocketInbound inbound, NettyWebSocketConnection connection,
                                              ChannelActor actor) {
        inbound.withConnection(conn -> {
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingIntervalInMillis = config.getPingInterval() * 1000L;

            conn.onWriteIdle(pingIntervalInMillis, () -> conn.outbound()
                    .sendObject(Mono.just(new PingWebSocketFrame()))
                    .then()
                    .subscribe(null, err -> log.debug("Ping failed on {}: {}", connection.getId(), err.getMessage())))
                .onReadIdle(idleTimeoutInMillis, () -> connection.close(CloseCodes.NORMAL, "Idle timeout"))
                .onDispose(() -> {
                    log.debug("WebSocket {} disposed, releasing it from {}", connection.getId(), actor.getShardKey());
                    connection.markClosed();
                    actor.onClose(connection).subscribe();
                });
        });
    }

    private Mono<Void> handleInboundMessages(WebsocketInbound inbound, NettyWebSocketConnection connection,
                                             ChannelActor actor) {
        return inbound.aggregateFrames()
            .receive()
            .asString()
            .onBackpressureBuffer(config.getPerConnBufferSize())
            .concatMap(frame -> actor.onMessage(connection, frame))
            .doOnError(err -> {
                // AbortedException is expected on close
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream of {}", connection.getId(), err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then(Mono.fromRunnable(connection::markClosed));
    }
}
