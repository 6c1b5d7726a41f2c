package sh.erebus.broker.channel;

import lombok.Builder;
import lombok.Value;
import sh.erebus.core.model.MessageBody;

import java.util.List;

/**
 * A sequenced message ready for local fan-out.
 */
@Value
@Builder
public class PublishMessageParams {
    MessageBody message;
    String senderId;
    /**
     * Subscriber list of the topic at publish time, as seen by the accepting shard.
     */
    List<String> subscriberIds;
    String projectId;
    String keyId;
    String channel;
    String topic;
    String seq;
}
