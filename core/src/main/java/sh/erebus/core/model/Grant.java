package sh.erebus.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Capability token payload scoping a connection to one project channel.
 * <p>
 * Issued and signed elsewhere, verified at connect time, then attached to the
 * socket for its whole lifetime. Authorization checks read it directly:
 * <ul>
 *   <li>{@link #hasTopicAccess}: any scope on the topic (subscribe)</li>
 *   <li>{@link #hasReadAccess}: read or read-write (receive broadcasts)</li>
 *   <li>{@link #hasWriteAccess}: write or read-write (publish)</li>
 *   <li>{@link #hasHuhAccess}: decoy scope</li>
 * </ul>
 * Each check matches the exact topic or the wildcard entry.
 * </p>
 * <p>
 * {@code issuedAt} and {@code expiresAt} are epoch seconds.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Grant {
    @JsonProperty("project_id")
    String projectId;

    /**
     * API key the grant was minted with; optional.
     */
    @JsonProperty("key_id")
    String keyId;

    @JsonProperty("channel")
    String channel;

    @JsonProperty("topics")
    List<TopicGrant> topics;

    @JsonProperty("userId")
    String userId;

    @JsonProperty("issuedAt")
    Long issuedAt;

    @JsonProperty("expiresAt")
    Long expiresAt;

    @JsonCreator
    public Grant(
        @JsonProperty("project_id") String projectId,
        @JsonProperty("key_id") String keyId,
        @JsonProperty("channel") String channel,
        @JsonProperty("topics") List<TopicGrant> topics,
        @JsonProperty("userId") String userId,
        @JsonProperty("issuedAt") Long issuedAt,
        @JsonProperty("expiresAt") Long expiresAt
    ) {
        this.projectId = projectId;
        this.keyId = keyId;
        this.channel = channel;
        this.topics = topics == null ? null : List.copyOf(topics);
        this.userId = userId;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    public boolean hasTopicAccess(String topic) {
        return topics.stream().anyMatch(t -> t.matches(topic));
    }

    public boolean hasReadAccess(String topic) {
        return topics.stream().anyMatch(t -> t.matches(topic) && t.getScope().canRead());
    }

    public boolean hasWriteAccess(String topic) {
        return topics.stream().anyMatch(t -> t.matches(topic) && t.getScope().canWrite());
    }

    public boolean hasHuhAccess(String topic) {
        return topics.stream().anyMatch(t -> t.matches(topic) && t.getScope() == Access.HUH);
    }

    /**
     * Topic names listed in the grant, wildcard included, in grant order.
     */
    public List<String> topicNames() {
        return topics.stream().map(TopicGrant::getTopic).distinct().collect(Collectors.toList());
    }

    /**
     * A zero or negative {@code expiresAt} means the grant carries no expiry of its own.
     */
    public boolean isExpiredAt(long epochSeconds) {
        return expiresAt > 0 && expiresAt < epochSeconds;
    }

    @JsonIgnore
    public boolean isWellFormed() {
        return projectId != null
            && channel != null
            && !channel.isEmpty()
            && userId != null
            && !userId.isEmpty()
            && issuedAt != null
            && expiresAt != null
            && topics != null
            && topics.stream().allMatch(t -> t != null && t.isWellFormed());
    }
}
