package sh.erebus.broker.channel;

import lombok.Getter;

/**
 * Thrown when a topic already holds the maximum number of subscribers.
 */
@Getter
public class CapacityExceededException extends RuntimeException {
    private final String topic;
    private final int capacity;

    public CapacityExceededException(String topic, int capacity) {
        super("Topic '" + topic + "' is full and has " + capacity + " or more subscribers");
        this.topic = topic;
        this.capacity = capacity;
    }
}
