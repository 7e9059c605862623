package ai.pipestream.staging.publish;

import ai.pipestream.staging.auth.OutboundCredential;
import io.smallrye.mutiny.Uni;

/**
 * Uploads a bundle to the publishing service.
 */
public interface PortalUploadClient {

    /**
     * @return the deployment id from the response body, verbatim
     */
    Uni<String> upload(OutboundCredential credential, String deploymentName, PublishingType publishingType,
                       byte[] bundle);
}
