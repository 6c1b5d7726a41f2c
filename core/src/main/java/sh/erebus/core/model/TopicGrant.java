package sh.erebus.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * One {@code {topic, scope}} entry of a grant. The topic may be the wildcard {@value #WILDCARD}.
 */
@Value
public class TopicGrant {
    public static final String WILDCARD = "*";

    @JsonProperty("topic")
    String topic;

    @JsonProperty("scope")
    Access scope;

    @JsonCreator
    public TopicGrant(@JsonProperty("topic") String topic, @JsonProperty("scope") Access scope) {
        this.topic = topic;
        this.scope = scope;
    }

    public boolean matches(String requestedTopic) {
        return WILDCARD.equals(topic) || topic.equals(requestedTopic);
    }

    @JsonIgnore
    public boolean isWellFormed() {
        return topic != null && scope != null;
    }
}
