package sh.erebus.broker.http;

import io.netty.handler.codec.http.QueryStringDecoder;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GrantExtractorTest {

    @Test
    void testFirstParam() {
        QueryStringDecoder decoder = new QueryStringDecoder("/v1/pubsub?grant=&grant=%20tok%20&limit=5");

        assertEquals(Optional.of("tok"), GrantExtractor.firstParam(decoder, GrantExtractor.GRANT_PARAM));
        assertEquals(Optional.of("5"), GrantExtractor.firstParam(decoder, "limit"));
        assertEquals(Optional.empty(), GrantExtractor.firstParam(decoder, "cursor"));
    }
}
