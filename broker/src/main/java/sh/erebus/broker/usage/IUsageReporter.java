package sh.erebus.broker.usage;

import reactor.core.publisher.Mono;
import sh.erebus.core.msg.UsageEvent;

/**
 * Billing/usage event sink.
 * <p>
 * Reporting is best effort: implementations log failures and complete normally,
 * so callers never have to guard against errors from {@link #report}.
 * </p>
 */
public interface IUsageReporter {

    /**
     * @param keyId may be null when the grant carries no key id
     */
    Mono<Void> report(UsageEvent event, String projectId, String keyId, long payloadLength);

    default void close() {
    }
}
