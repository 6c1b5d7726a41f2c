package sh.erebus.core.key;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistributedKeyTest {

    @Test
    @DisplayName("Should build channel and shard keys in segment order")
    void testChannelAndShardKeys() {
        assertEquals("proj:lobby:channel:v1", DistributedKey.forChannel("proj", "lobby"));
        assertEquals("proj:lobby:channel:v1:wnam", DistributedKey.forChannelShard("proj", "lobby", "wnam"));
    }

    @Test
    @DisplayName("Should parse a shard key back into its segments")
    void testParseShardKey() {
        DistributedKey.Parts parts = DistributedKey.parse("proj:lobby:channel:v1:weur");

        assertEquals("proj", parts.getProjectId());
        assertEquals("lobby", parts.getResource());
        assertEquals("channel", parts.getResourceType());
        assertEquals("v1", parts.getVersion());
        assertEquals("weur", parts.getLocationHint());
    }

    @Test
    @DisplayName("Should leave the location empty for 4-segment keys")
    void testParseChannelKey() {
        assertNull(DistributedKey.parse("proj:lobby:channel:v1").getLocationHint());
        assertEquals(Optional.empty(), DistributedKey.locationOf("proj:lobby:channel:v1"));
        assertEquals(Optional.of("apac"), DistributedKey.locationOf("proj:lobby:channel:v1:apac"));
    }

    @Test
    @DisplayName("Should reject keys with the wrong number of segments or empty segments")
    void testRejectMalformedKeys() {
        assertThrows(InvalidDistributedKeyException.class, () -> DistributedKey.parse("proj:lobby:channel"));
        assertThrows(InvalidDistributedKeyException.class, () -> DistributedKey.parse("a:b:c:d:e:f"));
        assertThrows(InvalidDistributedKeyException.class, () -> DistributedKey.parse("proj::channel:v1"));
        assertThrows(InvalidDistributedKeyException.class, () -> DistributedKey.parse(""));
        assertFalse(DistributedKey.isValid(null));
        assertEquals(Optional.empty(), DistributedKey.locationOf("garbage"));
    }

    @Test
    @DisplayName("Should refuse segments containing the separator")
    void testRejectSeparatorInSegment() {
        assertThrows(InvalidDistributedKeyException.class, () -> DistributedKey.forChannel("proj", "a:b"));
        assertThrows(InvalidDistributedKeyException.class,
                () -> DistributedKey.forChannelShard("proj", "lobby", "w:nam"));
    }

    @Test
    @DisplayName("Should add and strip the location hint")
    void testAppendAndRemoveLocation() {
        String channelKey = DistributedKey.forChannel("proj", "lobby");
        String shardKey = DistributedKey.appendLocationHint(channelKey, "enam");

        assertTrue(DistributedKey.isValid(shardKey));
        assertEquals(channelKey, DistributedKey.removeLocationHint(shardKey));
        assertEquals(channelKey, DistributedKey.removeLocationHint(channelKey));

        // A shard key cannot get a second location
        assertThrows(InvalidDistributedKeyException.class,
                () -> DistributedKey.appendLocationHint(shardKey, "weur"));
    }
}
