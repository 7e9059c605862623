package ai.pipestream.staging.exception;

/**
 * Thrown when the staging area on disk cannot be read or written.
 * Never retried; the operation that raised it has failed.
 */
public class StagingStorageException extends GatewayException {

    public StagingStorageException(String operation, String message, Throwable cause) {
        super("STORAGE_ERROR", operation, message, cause);
    }

    public static StagingStorageException ioFailure(String operation, Object target, Throwable cause) {
        return new StagingStorageException(operation, "I/O failure on " + target, cause);
    }
}
