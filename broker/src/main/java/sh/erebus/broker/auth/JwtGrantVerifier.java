package sh.erebus.broker.auth;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.erebus.core.model.Grant;
import sh.erebus.core.util.JsonUtils;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.util.Base64;

/**
 * Verifies compact JWS grant tokens signed with EdDSA over Ed25519.
 * <p>
 * <b>Checks, in order:</b>
 * <ul>
 *   <li>three base64url segments, header {@code alg} is {@code EdDSA}</li>
 *   <li>signature over {@code header.payload} with the configured public key</li>
 *   <li>{@code exp} and {@code nbf} claims, when present (epoch seconds)</li>
 *   <li>payload is a well-formed {@link Grant}</li>
 * </ul>
 * Registered JWT claims other than the grant fields are ignored.
 * </p>
 */
public class JwtGrantVerifier implements IGrantVerifier {
    private static final Logger log = LoggerFactory.getLogger(JwtGrantVerifier.class);

    private static final String ALGORITHM = "EdDSA";
    private static final String KEY_ALGORITHM = "Ed25519";

    // ASN.1 SubjectPublicKeyInfo header for a raw 32-byte Ed25519 key (OID 1.3.101.112)
    private static final byte[] ED25519_X509_PREFIX = {
        0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };
    private static final int ED25519_KEY_LENGTH = 32;

    private final PublicKey publicKey;
    private final Clock clock;

    public JwtGrantVerifier(PublicKey publicKey, Clock clock) {
        this.publicKey = publicKey;
        this.clock = clock;
    }

    /**
     * @param publicKeyJwk OKP JWK text, e.g. {@code {"kty":"OKP","crv":"Ed25519","x":"..."}}
     */
    public static JwtGrantVerifier fromJwk(String publicKeyJwk, Clock clock) {
        return new JwtGrantVerifier(parsePublicJwk(publicKeyJwk), clock);
    }

    public static PublicKey parsePublicJwk(String jwk) {
        JsonNode node;
        try {
            node = JsonUtils.mapper().readTree(jwk);
        } catch (Exception e) {
            throw new IllegalArgumentException("Public key JWK is not valid JSON", e);
        }
        if (!"OKP".equals(node.path("kty").asText()) || !KEY_ALGORITHM.equals(node.path("crv").asText())) {
            throw new IllegalArgumentException("Public key JWK must be an OKP Ed25519 key");
        }
        byte[] raw = Base64.getUrlDecoder().decode(node.path("x").asText());
        if (raw.length != ED25519_KEY_LENGTH) {
            throw new IllegalArgumentException("Ed25519 public key must be 32 bytes, got " + raw.length);
        }

        byte[] der = new byte[ED25519_X509_PREFIX.length + raw.length];
        System.arraycopy(ED25519_X509_PREFIX, 0, der, 0, ED25519_X509_PREFIX.length);
        System.arraycopy(raw, 0, der, ED25519_X509_PREFIX.length, raw.length);
        try {
            return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Unusable Ed25519 public key", e);
        }
    }

    @Override
    public Grant verify(String token) {
        if (token == null || token.isBlank()) {
            throw new GrantVerificationException("Grant token is empty");
        }
        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3) {
            throw new GrantVerificationException("Grant token is not a compact JWS");
        }

        JsonNode header = decodeSegment(parts[0], "header");
        if (!ALGORITHM.equals(header.path("alg").asText())) {
            throw new GrantVerificationException("Unsupported JWS algorithm: " + header.path("alg").asText());
        }

        verifySignature(parts);

        JsonNode claims = decodeSegment(parts[1], "payload");
        if (!claims.isObject()) {
            throw new GrantVerificationException("Grant payload is not a JSON object");
        }
        checkTimeClaims(claims);

        Grant grant;
        try {
            grant = JsonUtils.mapper().treeToValue(claims, Grant.class);
        } catch (Exception e) {
            throw new GrantVerificationException("Grant payload does not match the grant schema", e);
        }
        if (grant == null || !grant.isWellFormed()) {
            throw new GrantVerificationException("Grant payload does not match the grant schema");
        }
        log.debug("Verified grant for user {} on {}/{}", grant.getUserId(), grant.getProjectId(), grant.getChannel());
        return grant;
    }

    private void verifySignature(String[] parts) {
        byte[] signingInput = (parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        byte[] signature;
        try {
            signature = Base64.getUrlDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new GrantVerificationException("Grant signature is not base64url", e);
        }

        boolean valid;
        try {
            Signature verifier = Signature.getInstance(KEY_ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(signingInput);
            valid = verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            throw new GrantVerificationException("Grant signature could not be checked", e);
        }
        if (!valid) {
            throw new GrantVerificationException("Grant signature is invalid");
        }
    }

    private void checkTimeClaims(JsonNode claims) {
        long now = clock.instant().getEpochSecond();
        JsonNode exp = claims.get("exp");
        if (exp != null && exp.isNumber() && now >= exp.asLong()) {
            throw new GrantVerificationException("Grant token expired at " + exp.asLong());
        }
        JsonNode nbf = claims.get("nbf");
        if (nbf != null && nbf.isNumber() && now < nbf.asLong()) {
            throw new GrantVerificationException("Grant token not valid before " + nbf.asLong());
        }
    }

    private static JsonNode decodeSegment(String segment, String name) {
        try {
            byte[] json = Base64.getUrlDecoder().decode(segment);
            return JsonUtils.mapper().readTree(json);
        } catch (Exception e) {
            throw new GrantVerificationException("Grant " + name + " is not base64url JSON", e);
        }
    }
}
