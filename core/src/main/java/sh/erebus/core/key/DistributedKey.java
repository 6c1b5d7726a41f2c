package sh.erebus.core.key;

import lombok.Value;

import java.util.Optional;

/**
 * Colon-joined addressing scheme shared by the shard registry, per-shard storage and actor lookup.
 * <p>
 * <b>Format:</b> {@code projectId:resource:resourceType:version[:locationHint]}
 * <ul>
 *   <li>4 segments: logical resource (e.g. a channel across all regions)</li>
 *   <li>5 segments: one regional shard of that resource, location hint last</li>
 * </ul>
 * </p>
 * <p>
 * Segments must not contain {@code ':'}; {@link #stringify} rejects them so that
 * {@link #parse} can always split the key back.
 * </p>
 */
public final class DistributedKey {
    public static final String SEPARATOR = ":";
    public static final String CHANNEL_RESOURCE_TYPE = "channel";
    public static final String CHANNEL_VERSION = "v1";

    private static final int BASE_SEGMENTS = 4;
    private static final int SHARD_SEGMENTS = 5;

    private DistributedKey() {
    }

    public static String stringify(String projectId, String resource, String resourceType, String version) {
        return String.join(SEPARATOR,
            segment("projectId", projectId),
            segment("resource", resource),
            segment("resourceType", resourceType),
            segment("version", version)
        );
    }

    /**
     * Builds the 4-segment key of a channel.
     */
    public static String forChannel(String projectId, String channel) {
        return stringify(projectId, channel, CHANNEL_RESOURCE_TYPE, CHANNEL_VERSION);
    }

    /**
     * Builds the 5-segment key of one regional shard of a channel.
     */
    public static String forChannelShard(String projectId, String channel, String locationHint) {
        return appendLocationHint(forChannel(projectId, channel), locationHint);
    }

    /**
     * Appends a location hint to a 4-segment key.
     *
     * @throws InvalidDistributedKeyException if the key already carries a location or is malformed
     */
    public static String appendLocationHint(String key, String locationHint) {
        Parts parts = parse(key);
        if (parts.getLocationHint() != null) {
            throw new InvalidDistributedKeyException("Key already has a location hint: " + key);
        }
        return key + SEPARATOR + segment("locationHint", locationHint);
    }

    /**
     * Strips the location hint, returning the 4-segment key. Keys without a location are returned unchanged.
     */
    public static String removeLocationHint(String key) {
        Parts parts = parse(key);
        return stringify(parts.getProjectId(), parts.getResource(), parts.getResourceType(), parts.getVersion());
    }

    public static Parts parse(String key) {
        if (key == null || key.isEmpty()) {
            throw new InvalidDistributedKeyException("Distributed key is empty");
        }
        String[] segments = key.split(SEPARATOR, -1);
        if (segments.length != BASE_SEGMENTS && segments.length != SHARD_SEGMENTS) {
            throw new InvalidDistributedKeyException(
                "Expected " + BASE_SEGMENTS + " or " + SHARD_SEGMENTS + " segments but got "
                    + segments.length + ": " + key
            );
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new InvalidDistributedKeyException("Empty segment in distributed key: " + key);
            }
        }
        return new Parts(
            segments[0],
            segments[1],
            segments[2],
            segments[3],
            segments.length == SHARD_SEGMENTS ? segments[4] : null
        );
    }

    public static boolean isValid(String key) {
        try {
            parse(key);
            return true;
        } catch (InvalidDistributedKeyException e) {
            return false;
        }
    }

    /**
     * Location segment of a shard key, or empty for 4-segment keys and malformed input.
     */
    public static Optional<String> locationOf(String key) {
        if (!isValid(key)) {
            return Optional.empty();
        }
        return Optional.ofNullable(parse(key).getLocationHint());
    }

    private static String segment(String name, String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidDistributedKeyException(name + " must not be empty");
        }
        if (value.contains(SEPARATOR)) {
            throw new InvalidDistributedKeyException(name + " must not contain '" + SEPARATOR + "': " + value);
        }
        return value;
    }

    @Value
    public static class Parts {
        String projectId;
        String resource;
        String resourceType;
        String version;
        /**
         * Null for 4-segment keys.
         */
        String locationHint;
    }
}
