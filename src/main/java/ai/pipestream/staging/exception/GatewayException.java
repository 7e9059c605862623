package ai.pipestream.staging.exception;

/**
 * Base exception for all staging gateway operations.
 * Carries an error code and the operation that failed so that the HTTP layer
 * can map it without inspecting messages.
 */
public class GatewayException extends RuntimeException {

    private final String errorCode;
    private final String operation;

    public GatewayException(String errorCode, String operation, String message) {
        super(String.format("[%s] %s: %s", errorCode, operation, message));
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public GatewayException(String errorCode, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }
}
