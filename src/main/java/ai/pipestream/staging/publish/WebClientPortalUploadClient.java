package ai.pipestream.staging.publish;

import ai.pipestream.staging.auth.OutboundCredential;
import ai.pipestream.staging.config.GatewayConfig;
import ai.pipestream.staging.exception.UpstreamException;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.WebClient;
import io.vertx.mutiny.ext.web.multipart.MultipartForm;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Multipart {@code POST} of the bundle as the {@code bundle} part, with {@code name} and
 * {@code publishingType} query parameters.
 */
@ApplicationScoped
public class WebClientPortalUploadClient implements PortalUploadClient {

    private static final Logger LOG = Logger.getLogger(WebClientPortalUploadClient.class);

    static final String BUNDLE_PART = "bundle";
    static final String BUNDLE_FILE_NAME = "bundle.zip";

    @Inject
    WebClient webClient;

    @Inject
    GatewayConfig config;

    @Override
    public Uni<String> upload(OutboundCredential credential, String deploymentName, PublishingType publishingType,
                              byte[] bundle) {
        String url = stripTrailingSlash(config.central().url()) + config.central().uploadPath();
        MultipartForm form = MultipartForm.create()
                .binaryFileUpload(BUNDLE_PART, BUNDLE_FILE_NAME, Buffer.buffer(bundle), "application/octet-stream");

        LOG.debugf("Uploading %d byte bundle '%s' (%s) to %s", bundle.length, deploymentName, publishingType, url);
        return webClient.postAbs(url)
                .addQueryParam("name", deploymentName)
                .addQueryParam("publishingType", publishingType.name())
                .putHeader("Authorization", credential.authorizationHeader())
                .sendMultipartForm(form)
                .onFailure().transform(e -> new UpstreamException("upload", "Publishing service unreachable", e))
                .map(response -> {
                    String body = response.bodyAsString();
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new UpstreamException("upload", response.statusCode(),
                                "Publishing service rejected '" + deploymentName + "': " + body);
                    }
                    return body == null ? "" : body;
                });
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
