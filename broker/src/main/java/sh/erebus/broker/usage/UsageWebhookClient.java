package sh.erebus.broker.usage;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;
import sh.erebus.core.msg.UsageEnvelope;
import sh.erebus.core.util.JsonUtils;

import java.time.Duration;

/**
 * POSTs usage payloads to {@code {baseUrl}/api/v1/webhooks/usage}.
 */
public class UsageWebhookClient {
    private static final Logger log = LoggerFactory.getLogger(UsageWebhookClient.class);

    static final String USAGE_PATH = "/api/v1/webhooks/usage";
    private static final int MAX_RETRIES = 3;

    private final HttpClient httpClient;
    private final String url;

    public UsageWebhookClient(String baseUrl) {
        this.url = stripTrailingSlash(baseUrl) + USAGE_PATH;
        this.httpClient = HttpClient.create()
            .headers(h -> h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(Duration.ofSeconds(10));

        log.info("Usage webhook client targeting {}", url);
    }

    /**
     * Fails with {@link WebhookDeliveryException} once all attempts got a non-2xx answer or an IO error.
     */
    public Mono<Void> send(UsageEnvelope.Payload payload) {
        String body = JsonUtils.writeValueAsString(payload);
        return httpClient.post()
            .uri(url)
            .send(ByteBufFlux.fromString(Mono.just(body)))
            .responseSingle((response, content) -> {
                int status = response.status().code();
                if (status >= 200 && status < 300) {
                    return Mono.<Void>empty();
                }
                return content.asString()
                    .defaultIfEmpty("")
                    .flatMap(text -> Mono.<Void>error(new WebhookDeliveryException(status, text)));
            })
            .retry(MAX_RETRIES)
            .doOnSuccess(v -> log.debug("Delivered usage {} for project {}",
                payload.getEvent(), payload.getData().getProjectId()));
    }

    private static String stripTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
