package ai.pipestream.staging.http;

import ai.pipestream.staging.config.GatewayConfig;
import ai.pipestream.staging.http.api.StatusDocument;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

/**
 * Unauthenticated server status probe; always XML.
 */
@Path("/service/local/status")
public class StatusResource {

    @Inject
    GatewayConfig config;

    @Inject
    LegacyDocumentCodec codec;

    @GET
    public Response status(@Context UriInfo uriInfo) {
        String base = uriInfo.getBaseUri().toString();
        String baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return Response.ok(codec.write(LegacyDocumentCodec.Format.XML,
                        StatusDocument.started(config.legacy(), baseUrl)))
                .type(MediaType.APPLICATION_XML)
                .build();
    }
}
