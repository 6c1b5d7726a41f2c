package sh.erebus.broker.ws;

import java.util.Optional;

/**
 * One accepted WebSocket as seen by a channel actor.
 * <p>
 * The attachment is the only per-socket state the broker keeps, and it lives on the
 * connection itself so a channel actor can be dropped and recreated without losing it.
 * </p>
 */
public interface WebSocketConnection {

    String getId();

    boolean isOpen();

    /**
     * Bytes accepted by {@link #send} but not yet flushed to the network.
     */
    long getBufferedAmount();

    /**
     * Queues a text frame. Silently ignored once the socket is closed.
     */
    void send(String text);

    /**
     * Sends a close frame with the given status and reason. Idempotent.
     */
    void close(int code, String reason);

    void setAttachment(String attachment);

    Optional<String> getAttachment();
}
