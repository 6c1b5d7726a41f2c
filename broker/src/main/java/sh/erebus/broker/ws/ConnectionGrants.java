package sh.erebus.broker.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.erebus.core.model.Grant;
import sh.erebus.core.util.JsonUtils;

import java.util.Optional;

/**
 * Stores and reads back the grant serialized onto a connection.
 */
public final class ConnectionGrants {
    private static final Logger log = LoggerFactory.getLogger(ConnectionGrants.class);

    private ConnectionGrants() {
    }

    public static void attach(WebSocketConnection connection, Grant grant) {
        connection.setAttachment(JsonUtils.writeValueAsString(grant));
    }

    /**
     * @return the attached grant, or empty when none is attached or it no longer validates
     */
    public static Optional<Grant> read(WebSocketConnection connection) {
        return connection.getAttachment().flatMap(json -> {
            try {
                Grant grant = JsonUtils.readValue(json, Grant.class);
                return grant.isWellFormed() ? Optional.of(grant) : Optional.empty();
            } catch (IllegalArgumentException e) {
                log.warn("Discarding unreadable grant attachment on connection {}: {}",
                    connection.getId(), e.getMessage());
                return Optional.empty();
            }
        });
    }
}
