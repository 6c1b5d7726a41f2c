package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum UsageEvent {
    @JsonProperty("websocket.connect")
    CONNECT,
    @JsonProperty("websocket.subscribe")
    SUBSCRIBE,
    @JsonProperty("websocket.message")
    MESSAGE
}
