package sh.erebus.broker.channel;

import lombok.Value;

import java.util.List;

/**
 * Diagnostic snapshot of a shard's view of its siblings.
 */
@Value
public class ShardStatus {
    String myLocation;
    List<String> allShards;
    List<String> remoteShards;
    int totalShards;
    boolean shouldBroadcast;
}
