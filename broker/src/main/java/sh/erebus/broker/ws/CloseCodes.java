package sh.erebus.broker.ws;

/**
 * Application close codes (RFC 6455 private range), modelled on HTTP status codes.
 */
public final class CloseCodes {
    private CloseCodes() {
    }

    public static final int NORMAL = 1000;

    /**
     * Malformed packet, unknown packet type, failed authentication, missing grant.
     */
    public static final int BAD_REQUEST = 4400;

    public static final int UNAUTHORIZED = 4401;

    public static final int FORBIDDEN = 4403;

    /**
     * Server-side failure while processing a packet.
     */
    public static final int INTERNAL_SERVER_ERROR = 4500;
}
