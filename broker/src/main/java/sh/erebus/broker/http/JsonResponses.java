package sh.erebus.broker.http;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerResponse;
import sh.erebus.core.util.JsonUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON bodies of the HTTP routes. Errors are {@code {"error": ..., "timestamp": ...}}.
 */
public final class JsonResponses {
    private JsonResponses() {
    }

    public static Publisher<Void> ok(HttpServerResponse res, Object body) {
        return send(res, HttpResponseStatus.OK, JsonUtils.writeValueAsString(body));
    }

    public static Publisher<Void> error(HttpServerResponse res, HttpResponseStatus status, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("timestamp", Instant.now().toString());
        return send(res, status, JsonUtils.writeValueAsString(body));
    }

    private static Publisher<Void> send(HttpServerResponse res, HttpResponseStatus status, String json) {
        return res.status(status)
            .header(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
            .header(HttpHeaderNames.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
            .sendString(Mono.just(json));
    }
}
