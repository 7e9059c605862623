package ai.pipestream.staging.exception;

/**
 * Thrown anywhere in the credential chain: header parsing, legacy token decoding,
 * identity exchange and assertion verification. The reason is for operators only;
 * clients always see a plain 401.
 */
public class AuthenticationException extends GatewayException {

    public enum Reason {
        INVALID_HEADER,
        BASE64,
        UTF8,
        MALFORMED,
        EXCHANGE_FAILED,
        VERIFICATION_FAILED
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String message) {
        super("UNAUTHENTICATED", reason.name().toLowerCase(), message);
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, String message, Throwable cause) {
        super("UNAUTHENTICATED", reason.name().toLowerCase(), message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
