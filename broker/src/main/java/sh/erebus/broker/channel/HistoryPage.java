package sh.erebus.broker.channel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import sh.erebus.core.model.MessageBody;

import java.util.List;

/**
 * One page of buffered messages. {@code nextCursor} is null on the last page.
 */
@Value
public class HistoryPage {
    @JsonProperty("items")
    List<MessageBody> items;

    @JsonProperty("nextCursor")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    String nextCursor;
}
