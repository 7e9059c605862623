package ai.pipestream.staging.publish;

import ai.pipestream.staging.auth.OutboundCredential;
import ai.pipestream.staging.config.GatewayConfig;
import ai.pipestream.staging.metrics.GatewayMetrics;
import ai.pipestream.staging.repository.RepositoryKey;
import ai.pipestream.staging.repository.StagedArchive;
import ai.pipestream.staging.repository.StagingRepository;
import io.micrometer.core.instrument.Timer;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Finishes a staging repository and uploads the resulting bundle.
 * <p>
 * Finishing deletes the staged files, so a failed upload is not retried here;
 * the client has to stage the content again.
 */
@ApplicationScoped
public class PublishPipeline {

    private static final Logger LOG = Logger.getLogger(PublishPipeline.class);

    @Inject
    StagingRepository repository;

    @Inject
    PortalUploadClient uploadClient;

    @Inject
    GatewayMetrics metrics;

    @Inject
    GatewayConfig config;

    private String annotation;

    public PublishPipeline() {
    }

    PublishPipeline(StagingRepository repository, PortalUploadClient uploadClient, GatewayMetrics metrics,
                    String annotation) {
        this.repository = repository;
        this.uploadClient = uploadClient;
        this.metrics = metrics;
        this.annotation = annotation;
    }

    /**
     * The returned {@code Uni} is lazy: nothing is finished or uploaded, and no latency is
     * measured, until it is subscribed.
     */
    public Uni<String> publish(OutboundCredential credential, RepositoryKey key, PublishingType publishingType) {
        String deploymentName = deploymentName(key);
        return Uni.createFrom().deferred(() -> {
            Timer.Sample sample = metrics.startPublishTimer();
            return Uni.createFrom().item(() -> repository.finish(key))
                    .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                    .map(StagedArchive::toByteArray)
                    .onItem().transformToUni(bundle ->
                            uploadClient.upload(credential, deploymentName, publishingType, bundle))
                    .invoke(deploymentId -> {
                        metrics.stopPublishTimer(sample, true);
                        LOG.infof("Published %s as deployment %s (%s)", key, deploymentId, publishingType);
                    })
                    .onFailure().invoke(e -> {
                        metrics.stopPublishTimer(sample, false);
                        LOG.warnf("Publishing %s failed: %s", key, e.getMessage());
                    })
                    .onCancellation().invoke(() -> {
                        metrics.stopPublishTimer(sample, false);
                        LOG.debugf("Publishing %s was cancelled", key);
                    });
        });
    }

    String deploymentName(RepositoryKey key) {
        String suffix = annotation != null ? annotation : config.publish().deploymentNameAnnotation();
        return key.repositoryId() + " (" + suffix + ")";
    }
}
