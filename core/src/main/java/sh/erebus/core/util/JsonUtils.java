package sh.erebus.core.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for wire packets, storage records and Kafka payloads.
 * <p>
 * <b>Conventions:</b>
 * <ul>
 *   <li>null fields are omitted on write</li>
 *   <li>{@link java.time.Instant} is written as ISO-8601 text</li>
 *   <li>unknown properties are ignored on read; strictness lives in the model types</li>
 * </ul>
 * </p>
 * Read failures surface as {@link IllegalArgumentException} so callers can treat
 * them as bad input.
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse " + clazz.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public static <T> T readValue(String json, TypeReference<T> type) {
        try {
            return mapper().readValue(json, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse " + type.getType() + ": " + e.getMessage(), e);
        }
    }

    public static <T> T convertValue(Object value, Class<T> clazz) {
        try {
            return mapper().convertValue(value, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to convert to " + clazz.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
