package sh.erebus.broker.auth;

/**
 * A grant token failed signature, expiry or schema checks.
 */
public class GrantVerificationException extends RuntimeException {

    public GrantVerificationException(String message) {
        super(message);
    }

    public GrantVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
