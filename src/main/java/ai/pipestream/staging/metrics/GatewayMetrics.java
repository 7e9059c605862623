package ai.pipestream.staging.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Staging and publishing metrics, exposed via Micrometer.
 */
@ApplicationScoped
public class GatewayMetrics {

    @Inject
    MeterRegistry registry;

    private Counter repositoriesStartedTotal;
    private Counter filesStagedTotal;
    private DistributionSummary stagedFileBytes;
    private Counter publishSucceededTotal;
    private Counter publishFailedTotal;
    private Counter releasedTotal;
    private Timer publishLatency;

    public GatewayMetrics() {
    }

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
        init();
    }

    @PostConstruct
    void init() {
        repositoriesStartedTotal = Counter.builder("staging_repositories_started_total")
                .description("Staging repositories opened")
                .register(registry);

        filesStagedTotal = Counter.builder("staging_files_staged_total")
                .description("Files written into staging repositories")
                .register(registry);

        stagedFileBytes = DistributionSummary.builder("staging_file_bytes")
                .description("Size of staged files in bytes")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        publishSucceededTotal = Counter.builder("staging_publish_succeeded_total")
                .description("Bundles accepted by the publishing service")
                .register(registry);

        publishFailedTotal = Counter.builder("staging_publish_failed_total")
                .description("Publish attempts that failed")
                .register(registry);

        releasedTotal = Counter.builder("staging_repositories_released_total")
                .description("Staging repositories released")
                .register(registry);

        publishLatency = Timer.builder("staging_publish_latency_ms")
                .description("Latency of packaging and uploading a bundle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordRepositoryStarted() {
        repositoriesStartedTotal.increment();
    }

    public void recordFileStaged(long bytes) {
        filesStagedTotal.increment();
        stagedFileBytes.record(bytes);
    }

    public void recordReleased() {
        releasedTotal.increment();
    }

    public Timer.Sample startPublishTimer() {
        return Timer.start(registry);
    }

    public void stopPublishTimer(Timer.Sample sample, boolean success) {
        sample.stop(publishLatency);
        if (success) {
            publishSucceededTotal.increment();
        } else {
            publishFailedTotal.increment();
        }
    }
}
