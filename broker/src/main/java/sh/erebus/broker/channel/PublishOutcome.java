package sh.erebus.broker.channel;

import lombok.Value;

/**
 * Identity assigned to an accepted publish, echoed in the publish ack.
 */
@Value
public class PublishOutcome {
    String seq;
    String serverMsgId;
}
