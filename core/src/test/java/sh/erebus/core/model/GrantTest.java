package sh.erebus.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.erebus.core.util.JsonUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrantTest {

    private static Grant grant(TopicGrant... topics) {
        return Grant.builder()
                .projectId("proj")
                .channel("lobby")
                .topics(List.of(topics))
                .userId("alice")
                .issuedAt(1_000L)
                .expiresAt(2_000L)
                .build();
    }

    @Test
    @DisplayName("Should derive read, write and subscribe rights from scopes")
    void testScopes() {
        Grant grant = grant(
                new TopicGrant("news", Access.READ),
                new TopicGrant("inbox", Access.WRITE),
                new TopicGrant("chat", Access.READ_WRITE),
                new TopicGrant("secret", Access.HUH));

        assertTrue(grant.hasReadAccess("news"));
        assertFalse(grant.hasWriteAccess("news"));
        assertTrue(grant.hasWriteAccess("inbox"));
        assertFalse(grant.hasReadAccess("inbox"));
        assertTrue(grant.hasReadAccess("chat") && grant.hasWriteAccess("chat"));

        assertTrue(grant.hasHuhAccess("secret"));
        assertTrue(grant.hasTopicAccess("secret"));
        assertFalse(grant.hasReadAccess("secret"));

        assertFalse(grant.hasTopicAccess("other"));
    }

    @Test
    @DisplayName("Should let the wildcard entry match any topic")
    void testWildcard() {
        Grant grant = grant(new TopicGrant(TopicGrant.WILDCARD, Access.READ));

        assertTrue(grant.hasTopicAccess("anything"));
        assertTrue(grant.hasReadAccess("anything"));
        assertFalse(grant.hasWriteAccess("anything"));
        assertEquals(List.of("*"), grant.topicNames());
    }

    @Test
    @DisplayName("Should treat a non-positive expiry as no expiry")
    void testExpiry() {
        assertTrue(grant().isExpiredAt(2_001L));
        assertFalse(grant().isExpiredAt(2_000L));
        assertFalse(grant().toBuilder().expiresAt(0L).build().isExpiredAt(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("Should read the snake_case claim names and dashed scopes")
    void testJsonShape() {
        String json = "{\"project_id\":\"proj\",\"key_id\":\"k1\",\"channel\":\"lobby\",\"userId\":\"bob\","
                + "\"issuedAt\":1,\"expiresAt\":2,\"topics\":[{\"topic\":\"chat\",\"scope\":\"read-write\"},"
                + "{\"topic\":\"x\",\"scope\":\"huh?\"}]}";

        Grant grant = JsonUtils.readValue(json, Grant.class);

        assertTrue(grant.isWellFormed());
        assertEquals("k1", grant.getKeyId());
        assertEquals(Access.READ_WRITE, grant.getTopics().get(0).getScope());
        assertEquals(Access.HUH, grant.getTopics().get(1).getScope());
        assertTrue(JsonUtils.writeValueAsString(grant).contains("\"project_id\":\"proj\""));
    }

    @Test
    @DisplayName("Should flag grants with missing required fields and reject unknown scopes")
    void testValidation() {
        assertFalse(grant().toBuilder().userId("").build().isWellFormed());
        assertFalse(grant().toBuilder().topics(null).build().isWellFormed());
        assertFalse(grant().toBuilder().expiresAt(null).build().isWellFormed());
        assertThrows(IllegalArgumentException.class, () -> Access.fromWireName("admin"));
    }
}
