package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SubscriptionStatus {
    @JsonProperty("subscribed")
    SUBSCRIBED,
    @JsonProperty("unsubscribed")
    UNSUBSCRIBED
}
