package sh.erebus.broker.channel;

import reactor.core.publisher.Mono;
import sh.erebus.core.msg.PresencePacket;

import java.util.List;

/**
 * Notified after a subscription change has been committed.
 */
@FunctionalInterface
public interface PresenceListener {

    /**
     * @param subscribers the topic's subscriber list after the change
     */
    Mono<Void> onPresenceChange(PresencePacket presence, List<String> subscribers);
}
