package sh.erebus.broker.ws;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;
import sh.erebus.core.util.BytesUtils;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link WebSocketConnection} over a reactor-netty WebSocket.
 * <p>
 * Frames go through an unbounded sink drained by the outbound writer; the buffered amount
 * counts the bytes still queued in it. The attachment is kept as a Netty channel attribute.
 * </p>
 */
public class NettyWebSocketConnection implements WebSocketConnection {
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketConnection.class);

    static final AttributeKey<String> ATTACHMENT = AttributeKey.valueOf("erebus.grant");

    private final String id = UUID.randomUUID().toString();
    private final Channel channel;
    private final WebsocketOutbound outbound;
    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicLong bufferedBytes = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    NettyWebSocketConnection(Channel channel, WebsocketOutbound outbound) {
        this.channel = channel;
        this.outbound = outbound;
    }

    public static NettyWebSocketConnection create(WebsocketInbound inbound, WebsocketOutbound outbound) {
        AtomicReference<Channel> channel = new AtomicReference<>();
        inbound.withConnection(connection -> channel.set(connection.channel()));
        return new NettyWebSocketConnection(channel.get(), outbound);
    }

    /**
     * Frames to hand to {@link WebsocketOutbound#sendString}; completes on {@link #close}.
     */
    public Flux<String> outboundFlux() {
        return sink.asFlux()
            .doOnNext(text -> bufferedBytes.addAndGet(-BytesUtils.getBytesLength(text)));
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }

    @Override
    public long getBufferedAmount() {
        return Math.max(0, bufferedBytes.get());
    }

    @Override
    public void send(String text) {
        if (!isOpen()) {
            return;
        }
        long size = BytesUtils.getBytesLength(text);
        bufferedBytes.addAndGet(size);
        Sinks.EmitResult result = sink.tryEmitNext(text);
        if (result.isFailure()) {
            bufferedBytes.addAndGet(-size);
            log.debug("Dropped frame on connection {}: {}", id, result);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.debug("Closing connection {} with {} ({})", id, code, reason);
        sink.tryEmitComplete();
        outbound.sendClose(code, reason)
            .subscribe(null, err -> log.debug("Close frame not delivered on {}: {}", id, err.getMessage()));
    }

    /**
     * Marks the socket closed after the peer or the transport ended it.
     */
    void markClosed() {
        if (closed.compareAndSet(false, true)) {
            sink.tryEmitComplete();
        }
    }

    @Override
    public void setAttachment(String attachment) {
        channel.attr(ATTACHMENT).set(attachment);
    }

    @Override
    public Optional<String> getAttachment() {
        return Optional.ofNullable(channel.attr(ATTACHMENT).get());
    }
}
