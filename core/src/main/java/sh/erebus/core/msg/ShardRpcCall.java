package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Value;
import sh.erebus.core.model.MessageBody;

import java.util.List;

/**
 * Cross-shard RPC invocation, addressed to one 5-segment shard key.
 * <p>
 * Travels over Kafka on {@link Topics#shardRpcTopicFor(String)} of the target
 * shard's location and is dispatched to that shard's actor by the node serving it.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "method")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ShardRpcCall.PublishMessage.class, name = ShardRpcCall.PublishMessage.METHOD),
    @JsonSubTypes.Type(value = ShardRpcCall.SetShards.class, name = ShardRpcCall.SetShards.METHOD)
})
public sealed interface ShardRpcCall permits ShardRpcCall.PublishMessage, ShardRpcCall.SetShards {

    String getMethod();

    String getTargetShardKey();

    /**
     * Replicates an already-sequenced message to a sibling shard.
     */
    @Value
    class PublishMessage implements ShardRpcCall {
        public static final String METHOD = "publishMessage";

        @JsonProperty("targetShardKey")
        String targetShardKey;

        @JsonProperty("message")
        MessageBody message;

        @JsonProperty("senderId")
        String senderId;

        @JsonProperty("subscriberIds")
        List<String> subscriberIds;

        @JsonProperty("projectId")
        String projectId;

        @JsonProperty("keyId")
        String keyId;

        @JsonProperty("channel")
        String channel;

        @JsonProperty("topic")
        String topic;

        @JsonProperty("seq")
        String seq;

        @JsonProperty("ingressTs")
        double ingressTs;

        @JsonCreator
        public PublishMessage(
            @JsonProperty("targetShardKey") String targetShardKey,
            @JsonProperty("message") MessageBody message,
            @JsonProperty("senderId") String senderId,
            @JsonProperty("subscriberIds") List<String> subscriberIds,
            @JsonProperty("projectId") String projectId,
            @JsonProperty("keyId") String keyId,
            @JsonProperty("channel") String channel,
            @JsonProperty("topic") String topic,
            @JsonProperty("seq") String seq,
            @JsonProperty("ingressTs") double ingressTs
        ) {
            this.targetShardKey = targetShardKey;
            this.message = message;
            this.senderId = senderId;
            this.subscriberIds = subscriberIds == null ? List.of() : List.copyOf(subscriberIds);
            this.projectId = projectId;
            this.keyId = keyId;
            this.channel = channel;
            this.topic = topic;
            this.seq = seq;
            this.ingressTs = ingressTs;
        }

        @Override
        public String getMethod() {
            return METHOD;
        }
    }

    /**
     * Pushes the current membership list of a channel to one of its shards.
     */
    @Value
    class SetShards implements ShardRpcCall {
        public static final String METHOD = "setShardsInLocalStorage";

        @JsonProperty("targetShardKey")
        String targetShardKey;

        @JsonProperty("shardKeys")
        List<String> shardKeys;

        @JsonCreator
        public SetShards(
            @JsonProperty("targetShardKey") String targetShardKey,
            @JsonProperty("shardKeys") List<String> shardKeys
        ) {
            this.targetShardKey = targetShardKey;
            this.shardKeys = shardKeys == null ? List.of() : List.copyOf(shardKeys);
        }

        @Override
        public String getMethod() {
            return METHOD;
        }
    }
}
