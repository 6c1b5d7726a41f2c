package sh.erebus.broker.auth;

import sh.erebus.core.model.Grant;

/**
 * Turns a signed grant token into a trusted {@link Grant}.
 */
public interface IGrantVerifier {

    /**
     * @throws GrantVerificationException if the token is malformed, badly signed, expired
     *                                    or does not carry a well-formed grant
     */
    Grant verify(String token);
}
