package ai.pipestream.staging.http;

import ai.pipestream.staging.auth.CallerContext;
import ai.pipestream.staging.auth.IdentityContext;
import ai.pipestream.staging.publish.PublishPipeline;
import ai.pipestream.staging.publish.PublishingType;
import ai.pipestream.staging.repository.RepositoryKey;
import ai.pipestream.staging.repository.StagingRepository;
import io.smallrye.common.annotation.Blocking;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

/**
 * Publishes the caller's no-profile repository on demand.
 */
@Path("/manual")
@Blocking
public class ManualUploadResource {

    private static final Logger LOG = Logger.getLogger(ManualUploadResource.class);

    @Inject
    StagingRepository repository;

    @Inject
    PublishPipeline publishPipeline;

    @Inject
    CallerContext caller;

    @POST
    @Path("/upload/defaultRepository")
    public Uni<Response> uploadDefaultRepository(@QueryParam("publishing_type") String publishingType) {
        IdentityContext identity = caller.identity();
        RepositoryKey key = repository.openWithoutNamespace(identity.owner(), caller.clientAddress());
        PublishingType type = PublishingType.fromParameter(publishingType);
        LOG.infof("Manual upload of %s for %s (%s)", key.repositoryId(), identity.username(), type);
        return publishPipeline.publish(identity.credential(), key, type)
                .map(deploymentId -> Response.ok().build());
    }
}
