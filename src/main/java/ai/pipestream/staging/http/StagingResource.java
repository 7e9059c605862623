package ai.pipestream.staging.http;

import ai.pipestream.staging.auth.CallerContext;
import ai.pipestream.staging.auth.IdentityContext;
import ai.pipestream.staging.exception.InvalidRequestException;
import ai.pipestream.staging.http.api.ProfileResponseDocument;
import ai.pipestream.staging.http.api.PromoteRequest;
import ai.pipestream.staging.http.api.PromoteResponseDocument;
import ai.pipestream.staging.http.api.StagingActionRequest;
import ai.pipestream.staging.http.api.StagingProfilesDocument;
import ai.pipestream.staging.http.api.StagingRepositoryDocument;
import ai.pipestream.staging.metrics.GatewayMetrics;
import ai.pipestream.staging.publish.PublishPipeline;
import ai.pipestream.staging.publish.PublishingType;
import ai.pipestream.staging.repository.RepositoryKey;
import ai.pipestream.staging.repository.RepositoryState;
import ai.pipestream.staging.repository.StagingRepository;
import io.smallrye.common.annotation.Blocking;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.util.List;

/**
 * The legacy staging API used by build tool staging plugins.
 * <p>
 * Typical flow: evaluate the profile for a group, start a repository in it, upload
 * files by repository id, then finish (close) it, which publishes the bundle.
 * Deploys without a profile go to the caller's implicit no-profile repository.
 */
@Path("/service/local/staging")
@Blocking
public class StagingResource {

    private static final Logger LOG = Logger.getLogger(StagingResource.class);

    static final String MAVEN_METADATA = "maven-metadata.xml";

    @Inject
    StagingRepository repository;

    @Inject
    PublishPipeline publishPipeline;

    @Inject
    LegacyDocumentCodec codec;

    @Inject
    CallerContext caller;

    @Inject
    GatewayMetrics metrics;

    @Context
    UriInfo uriInfo;

    @GET
    @Path("/profile_evaluate")
    public Response evaluateProfile(@Context HttpHeaders headers,
                                    @QueryParam("a") String artifactId,
                                    @QueryParam("t") String repositoryType,
                                    @QueryParam("v") String version,
                                    @QueryParam("g") String group) {
        if (group == null || group.isBlank()) {
            throw new InvalidRequestException("profileEvaluate", "Missing query parameter g");
        }
        LOG.debugf("Evaluating staging profile for %s:%s:%s", group, artifactId, version);
        return codec.respond(headers, StagingProfilesDocument.evaluate(baseUrl(), List.of(group)));
    }

    @GET
    @Path("/profiles")
    public Response listProfiles(@Context HttpHeaders headers) {
        IdentityContext identity = caller.identity();
        LOG.debugf("Listing staging profiles for %s", identity.username());
        return codec.respond(headers, StagingProfilesDocument.evaluate(baseUrl(), identity.namespaces()));
    }

    @GET
    @Path("/profiles/{profileId}")
    public Response getProfile(@Context HttpHeaders headers, @PathParam("profileId") String profileId) {
        return codec.respond(headers, ProfileResponseDocument.of(baseUrl(), profileId));
    }

    @POST
    @Path("/profiles/{profileId}/start")
    public Response start(@Context HttpHeaders headers, @PathParam("profileId") String profileId, byte[] body) {
        PromoteRequest request = codec.read(headers, body, PromoteRequest.class);
        IdentityContext identity = caller.identity();
        identity.namespaceAuthorization().requireNamespace("start", profileId);

        RepositoryKey key = repository.start(identity.owner(), caller.clientAddress(), profileId);
        metrics.recordRepositoryStarted();
        LOG.infof("Started staging repository %s for %s", key.repositoryId(), identity.username());

        String description = request.data == null ? null : request.data.description;
        return codec.respond(headers, PromoteResponseDocument.of(key.repositoryId(), description));
    }

    @PUT
    @Path("/deployByRepositoryId/{repositoryId}/{filePath: .+}")
    public Response deployByRepositoryId(@PathParam("repositoryId") String repositoryId,
                                         @PathParam("filePath") String filePath,
                                         InputStream body) {
        if (filePath.contains(MAVEN_METADATA)) {
            LOG.debugf("Skipping metadata file %s", filePath);
            return Response.status(Response.Status.CREATED).build();
        }
        IdentityContext identity = caller.identity();
        RepositoryKey key = keyFor(identity, repositoryId);
        stage(identity, key, filePath, body);
        return Response.status(Response.Status.CREATED).build();
    }

    @GET
    @Path("/deployByRepositoryId/{repositoryId}/{filePath: .+}")
    public Response readByRepositoryId(@PathParam("repositoryId") String repositoryId,
                                       @PathParam("filePath") String filePath) {
        LOG.debugf("Staged content is not served back: %s/%s", repositoryId, filePath);
        return Response.status(Response.Status.NOT_FOUND).build();
    }

    @PUT
    @Path("/deploy/maven2/{filePath: .+}")
    public Response deployWithoutProfile(@PathParam("filePath") String filePath, InputStream body) {
        if (filePath.contains(MAVEN_METADATA)) {
            LOG.debugf("Skipping metadata file %s", filePath);
            return Response.status(Response.Status.CREATED).build();
        }
        IdentityContext identity = caller.identity();
        RepositoryKey key = repository.openWithoutNamespace(identity.owner(), caller.clientAddress());
        stage(identity, key, filePath, body);
        return Response.status(Response.Status.CREATED).build();
    }

    @GET
    @Path("/deploy/maven2/{filePath: .+}")
    public Response readWithoutProfile(@PathParam("filePath") String filePath) {
        LOG.debugf("Staged content is not served back: %s", filePath);
        return Response.status(Response.Status.NOT_FOUND).build();
    }

    @POST
    @Path("/profiles/{profileId}/finish")
    public Uni<Response> finish(@Context HttpHeaders headers, @PathParam("profileId") String profileId, byte[] body) {
        PromoteRequest request = codec.read(headers, body, PromoteRequest.class);
        if (request.data == null || request.data.stagedRepositoryId == null) {
            throw new InvalidRequestException("finish", "Missing stagedRepositoryId");
        }
        IdentityContext identity = caller.identity();
        RepositoryKey key = keyFor(identity, request.data.stagedRepositoryId);
        LOG.infof("Finishing %s in profile %s", key.repositoryId(), profileId);
        return publishPipeline.publish(identity.credential(), key, PublishingType.AUTOMATIC)
                .map(deploymentId -> Response.ok().build());
    }

    @GET
    @Path("/repository/{repositoryId}")
    public Response getRepository(@Context HttpHeaders headers, @PathParam("repositoryId") String repositoryId) {
        RepositoryKey key = keyFor(caller.identity(), repositoryId);
        RepositoryState state = repository.getState(key);
        return codec.respond(headers, StagingRepositoryDocument.of(baseUrl(), repositoryId, state));
    }

    @POST
    @Path("/bulk/close")
    public Uni<Response> bulkClose(@Context HttpHeaders headers, byte[] body) {
        List<String> ids = repositoryIds(codec.read(headers, body, StagingActionRequest.class));
        IdentityContext identity = caller.identity();
        List<RepositoryKey> keys = ids.stream().map(id -> keyFor(identity, id)).toList();
        LOG.infof("Bulk close of %s", ids);
        return Multi.createFrom().iterable(keys)
                .onItem().transformToUniAndConcatenate(
                        key -> publishPipeline.publish(identity.credential(), key, PublishingType.AUTOMATIC))
                .collect().asList()
                .map(deploymentIds -> Response.ok().build());
    }

    @POST
    @Path("/bulk/promote")
    public Response bulkPromote(@Context HttpHeaders headers, byte[] body) {
        List<String> ids = repositoryIds(codec.read(headers, body, StagingActionRequest.class));
        IdentityContext identity = caller.identity();
        LOG.infof("Bulk promote of %s", ids);
        for (String id : ids) {
            repository.release(keyFor(identity, id));
            metrics.recordReleased();
        }
        return Response.ok().build();
    }

    private void stage(IdentityContext identity, RepositoryKey key, String filePath, InputStream body) {
        long bytes = repository.addFile(identity.namespaceAuthorization(), key, filePath, body);
        metrics.recordFileStaged(bytes);
    }

    private RepositoryKey keyFor(IdentityContext identity, String repositoryId) {
        return RepositoryKey.fromRepositoryId(identity.owner(), caller.clientAddress(), repositoryId);
    }

    private static List<String> repositoryIds(StagingActionRequest request) {
        if (request.data == null || request.data.stagedRepositoryIds == null) {
            return List.of();
        }
        return request.data.stagedRepositoryIds;
    }

    private String baseUrl() {
        String base = uriInfo.getBaseUri().toString();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
