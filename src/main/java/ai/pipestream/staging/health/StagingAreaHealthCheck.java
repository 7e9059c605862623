package ai.pipestream.staging.health;

import ai.pipestream.staging.repository.LocalStagingRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Ready while the staging root exists and is writable.
 */
@Readiness
@ApplicationScoped
public class StagingAreaHealthCheck implements HealthCheck {

    @Inject
    LocalStagingRepository repository;

    @Override
    public HealthCheckResponse call() {
        Path root = repository.root();
        boolean usable = Files.isDirectory(root) && Files.isWritable(root);
        return HealthCheckResponse.named("staging-gateway")
                .withData("stagingRoot", root.toString())
                .withData("writable", usable)
                .status(usable)
                .build();
    }
}
