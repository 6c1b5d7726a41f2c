package sh.erebus.broker.support;

import lombok.Value;
import reactor.core.publisher.Mono;
import sh.erebus.broker.usage.IUsageReporter;
import sh.erebus.core.msg.UsageEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Usage reporter stub keeping every reported event.
 */
public class RecordingUsageReporter implements IUsageReporter {
    private final List<Reported> events = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> report(UsageEvent event, String projectId, String keyId, long payloadLength) {
        return Mono.fromRunnable(() -> events.add(new Reported(event, projectId, keyId, payloadLength)));
    }

    public List<Reported> getEvents() {
        return events;
    }

    @Value
    public static class Reported {
        UsageEvent event;
        String projectId;
        String keyId;
        long payloadLength;
    }
}
