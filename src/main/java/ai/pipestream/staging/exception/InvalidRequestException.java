package ai.pipestream.staging.exception;

/**
 * Thrown when a client request cannot be honoured as sent: unknown or forged
 * repository keys, directory traversal attempts, malformed repository ids,
 * lifecycle violations and unauthorized namespaces.
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String operation, String message) {
        super("INVALID_REQUEST", operation, message);
    }

    public InvalidRequestException(String operation, String message, Throwable cause) {
        super("INVALID_REQUEST", operation, message, cause);
    }

    public static InvalidRequestException unknownRepository(String operation, Object repositoryKey) {
        return new InvalidRequestException(operation, "Repository " + repositoryKey + " does not exist");
    }

    public static InvalidRequestException invalidPath(String operation, String path) {
        return new InvalidRequestException(operation, "Invalid path to upload: " + path);
    }

    public static InvalidRequestException invalidRepositoryId(String operation, String repositoryId) {
        return new InvalidRequestException(operation, "Invalid repository id: " + repositoryId);
    }

    public static InvalidRequestException namespaceNotAuthorized(String operation, String namespace) {
        return new InvalidRequestException(operation, "Namespace not authorized: " + namespace);
    }
}
