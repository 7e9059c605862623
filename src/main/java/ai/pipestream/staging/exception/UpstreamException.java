package ai.pipestream.staging.exception;

/**
 * Thrown when a downstream service (identity exchange or bundle publishing)
 * answers with a non-2xx status or cannot be reached.
 */
public class UpstreamException extends GatewayException {

    private final int statusCode;

    public UpstreamException(String operation, int statusCode, String message) {
        super("UPSTREAM_ERROR", operation, String.format("status=%d, %s", statusCode, message));
        this.statusCode = statusCode;
    }

    public UpstreamException(String operation, String message, Throwable cause) {
        super("UPSTREAM_ERROR", operation, message, cause);
        this.statusCode = -1;
    }

    /**
     * @return the HTTP status the upstream answered with, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
