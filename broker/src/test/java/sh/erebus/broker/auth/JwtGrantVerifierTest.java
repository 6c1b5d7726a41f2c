package sh.erebus.broker.auth;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.erebus.broker.support.TestFixtures;
import sh.erebus.core.model.Access;
import sh.erebus.core.model.Grant;
import sh.erebus.core.util.JsonUtils;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sh.erebus.broker.support.TestFixtures.topic;

class JwtGrantVerifierTest {

    private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();

    private static KeyPair keyPair;
    private static JwtGrantVerifier verifier;

    @BeforeAll
    static void setUpKeys() throws Exception {
        keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        verifier = JwtGrantVerifier.fromJwk(jwkOf(keyPair), TestFixtures.fixedClock());
    }

    @Test
    @DisplayName("Should accept a correctly signed grant")
    void testValidToken() throws Exception {
        String token = sign(keyPair.getPrivate(), header("EdDSA"), claims(Map.of()));

        Grant grant = verifier.verify(token);

        assertEquals("alice", grant.getUserId());
        assertEquals("proj", grant.getProjectId());
        assertEquals(Access.READ_WRITE, grant.getTopics().get(0).getScope());
    }

    @Test
    @DisplayName("Should reject a token signed by another key")
    void testForeignKey() throws Exception {
        KeyPair other = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        String token = sign(other.getPrivate(), header("EdDSA"), claims(Map.of()));

        assertThrows(GrantVerificationException.class, () -> verifier.verify(token));
    }

    @Test
    @DisplayName("Should reject a tampered payload")
    void testTamperedPayload() throws Exception {
        String token = sign(keyPair.getPrivate(), header("EdDSA"), claims(Map.of()));
        String[] parts = token.split("\\.");
        String forged = parts[0] + "." + B64.encodeToString(
                claims(Map.of("userId", "mallory")).getBytes(StandardCharsets.UTF_8)) + "." + parts[2];

        assertThrows(GrantVerificationException.class, () -> verifier.verify(forged));
    }

    @Test
    @DisplayName("Should reject other algorithms and malformed tokens")
    void testMalformed() throws Exception {
        String hs256 = sign(keyPair.getPrivate(), header("HS256"), claims(Map.of()));

        assertThrows(GrantVerificationException.class, () -> verifier.verify(hs256));
        assertThrows(GrantVerificationException.class, () -> verifier.verify(""));
        assertThrows(GrantVerificationException.class, () -> verifier.verify("a.b"));
        assertThrows(GrantVerificationException.class, () -> verifier.verify("%%%.###.!!!"));
    }

    @Test
    @DisplayName("Should enforce exp and nbf claims")
    void testTimeClaims() throws Exception {
        long now = TestFixtures.NOW.getEpochSecond();
        String expired = sign(keyPair.getPrivate(), header("EdDSA"), claims(Map.of("exp", now - 1)));
        String notYet = sign(keyPair.getPrivate(), header("EdDSA"), claims(Map.of("nbf", now + 60)));

        assertThrows(GrantVerificationException.class, () -> verifier.verify(expired));
        assertThrows(GrantVerificationException.class, () -> verifier.verify(notYet));
    }

    @Test
    @DisplayName("Should reject a signed payload that is not a grant")
    void testSchema() throws Exception {
        String token = sign(keyPair.getPrivate(), header("EdDSA"), "{\"sub\":\"alice\"}");

        assertThrows(GrantVerificationException.class, () -> verifier.verify(token));
    }

    @Test
    @DisplayName("Should refuse JWKs that are not Ed25519 public keys")
    void testBadJwk() {
        assertThrows(IllegalArgumentException.class,
                () -> JwtGrantVerifier.parsePublicJwk("{\"kty\":\"RSA\",\"n\":\"x\",\"e\":\"AQAB\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> JwtGrantVerifier.parsePublicJwk("{\"kty\":\"OKP\",\"crv\":\"Ed25519\",\"x\":\"AAAA\"}"));
        assertThrows(IllegalArgumentException.class, () -> JwtGrantVerifier.parsePublicJwk("not json"));
    }

    private static String jwkOf(KeyPair pair) {
        byte[] encoded = pair.getPublic().getEncoded();
        byte[] raw = Arrays.copyOfRange(encoded, encoded.length - 32, encoded.length);
        return "{\"kty\":\"OKP\",\"crv\":\"Ed25519\",\"x\":\"" + B64.encodeToString(raw) + "\"}";
    }

    private static String header(String alg) {
        return "{\"alg\":\"" + alg + "\",\"typ\":\"JWT\"}";
    }

    private static String claims(Map<String, Object> overrides) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("project_id", "proj");
        claims.put("key_id", "key-1");
        claims.put("channel", "lobby");
        claims.put("topics", List.of(topic("chat", Access.READ_WRITE)));
        claims.put("userId", "alice");
        claims.put("issuedAt", TestFixtures.NOW.getEpochSecond());
        claims.put("expiresAt", TestFixtures.NOW.getEpochSecond() + 3600);
        claims.putAll(overrides);
        return JsonUtils.writeValueAsString(claims);
    }

    private static String sign(PrivateKey key, String header, String payload) throws Exception {
        String signingInput = B64.encodeToString(header.getBytes(StandardCharsets.UTF_8)) + "."
                + B64.encodeToString(payload.getBytes(StandardCharsets.UTF_8));
        Signature signer = Signature.getInstance("Ed25519");
        signer.initSign(key);
        signer.update(signingInput.getBytes(StandardCharsets.US_ASCII));
        return signingInput + "." + B64.encodeToString(signer.sign());
    }
}
