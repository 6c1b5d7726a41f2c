package sh.erebus.broker.http;

import io.netty.handler.codec.http.QueryStringDecoder;
import reactor.netty.http.server.HttpServerRequest;

import java.util.Collection;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the grant token of an HTTP request: query {@code grant} first, then header {@code X-Erebus-Grant}.
 * Browsers cannot set headers on a WebSocket handshake, hence the query parameter.
 */
public final class GrantExtractor {
    public static final String GRANT_PARAM = "grant";
    public static final String GRANT_HEADER = "X-Erebus-Grant";

    private GrantExtractor() {
    }

    public static Optional<String> extract(HttpServerRequest req) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        Optional<String> fromQuery = firstParam(decoder, GRANT_PARAM);
        if (fromQuery.isPresent()) {
            return fromQuery;
        }
        return Optional.ofNullable(req.requestHeaders().get(GRANT_HEADER))
            .map(String::trim)
            .filter(value -> !value.isEmpty());
    }

    static Optional<String> firstParam(QueryStringDecoder decoder, String name) {
        return Stream.ofNullable(decoder.parameters().get(name))
            .flatMap(Collection::stream)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .findFirst();
    }
}
