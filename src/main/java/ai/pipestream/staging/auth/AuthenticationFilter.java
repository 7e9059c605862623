package ai.pipestream.staging.auth;

import ai.pipestream.staging.exception.AuthenticationException;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

/**
 * Authenticates the staging and manual upload endpoints.
 * <p>
 * Clients only ever see a bare 401; the reason is logged.
 */
public class AuthenticationFilter {

    private static final Logger LOG = Logger.getLogger(AuthenticationFilter.class);

    static final String IDENTITY_PROPERTY = "staging.identity";
    static final String REALM = "Basic realm=\"Sonatype Nexus Repository Manager API\"";

    @Inject
    CredentialBridge credentialBridge;

    @Inject
    CallerContext callerContext;

    @ServerRequestFilter(priority = Priorities.AUTHENTICATION)
    public Uni<Response> authenticate(ContainerRequestContext requestContext) {
        if (!requiresAuthentication(requestContext.getUriInfo().getPath())) {
            return Uni.createFrom().nullItem();
        }
        String header = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);
        return credentialBridge.authenticate(header)
                .map(identity -> {
                    requestContext.setProperty(IDENTITY_PROPERTY, identity);
                    return (Response) null;
                })
                .onFailure().recoverWithItem(e -> {
                    if (e instanceof AuthenticationException) {
                        AuthenticationException auth = (AuthenticationException) e;
                        LOG.warnf("Authentication failed (%s): %s", auth.getReason(), auth.getMessage());
                    } else {
                        LOG.warnf(e, "Authentication failed unexpectedly");
                    }
                    return unauthorized();
                });
    }

    @ServerRequestFilter(priority = Priorities.AUTHORIZATION)
    public void bindCaller(ContainerRequestContext requestContext, HttpServerRequest request) {
        Object identity = requestContext.getProperty(IDENTITY_PROPERTY);
        if (identity instanceof IdentityContext) {
            String address = request.remoteAddress() == null ? null : request.remoteAddress().hostAddress();
            callerContext.set((IdentityContext) identity, address);
        }
    }

    static boolean requiresAuthentication(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return relative.startsWith("service/local/staging") || relative.startsWith("manual/");
    }

    static Response unauthorized() {
        return Response.status(Response.Status.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, REALM)
                .type(MediaType.TEXT_PLAIN)
                .entity("Unauthorized")
                .build();
    }
}
