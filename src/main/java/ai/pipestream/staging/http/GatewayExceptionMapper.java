package ai.pipestream.staging.http;

import ai.pipestream.staging.exception.AuthenticationException;
import ai.pipestream.staging.exception.GatewayException;
import ai.pipestream.staging.exception.InvalidRequestException;
import ai.pipestream.staging.exception.StagingStorageException;
import ai.pipestream.staging.exception.UpstreamException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps gateway failures to plain-text HTTP responses.
 */
@Provider
public class GatewayExceptionMapper implements ExceptionMapper<GatewayException> {

    private static final Logger LOG = Logger.getLogger(GatewayExceptionMapper.class);

    @Override
    public Response toResponse(GatewayException exception) {
        if (exception instanceof AuthenticationException) {
            LOG.warnf("Rejecting request: %s", exception.getMessage());
            return text(Response.Status.UNAUTHORIZED, "Unauthorized");
        }
        if (exception instanceof InvalidRequestException) {
            LOG.debugf("Returning error to client: %s", exception.getMessage());
            return text(Response.Status.BAD_REQUEST, "Failed to process request: " + exception.getMessage());
        }
        if (exception instanceof UpstreamException) {
            LOG.errorf(exception, "Upstream call failed");
            return text(Response.Status.BAD_GATEWAY, "Upstream service failed: " + exception.getMessage());
        }
        if (exception instanceof StagingStorageException) {
            LOG.errorf(exception, "Staging storage failure");
        } else {
            LOG.errorf(exception, "Unhandled gateway failure");
        }
        return text(Response.Status.INTERNAL_SERVER_ERROR, "Internal error: " + exception.getErrorCode());
    }

    private static Response text(Response.Status status, String body) {
        return Response.status(status).type(MediaType.TEXT_PLAIN).entity(body).build();
    }
}
