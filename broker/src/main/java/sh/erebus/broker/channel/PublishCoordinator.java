package sh.erebus.broker.channel;

import reactor.core.publisher.Mono;
import sh.erebus.core.model.MessageBody;

/**
 * Sequences a publish and distributes it to every shard of the channel.
 */
public interface PublishCoordinator {

    /**
     * @param tIngress  monotonic millis when the packet arrived
     * @param tEnqueued monotonic millis when it passed authorization
     * @return errors when the message could not be sequenced or delivered locally;
     * remote shard failures never surface here
     */
    Mono<PublishOutcome> broadcastToAllShards(MessageBody payload, String senderId, String topic,
                                              String projectId, String keyId, String channel,
                                              double tIngress, double tEnqueued);
}
