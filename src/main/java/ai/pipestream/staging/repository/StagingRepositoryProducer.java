package ai.pipestream.staging.repository;

import ai.pipestream.staging.config.GatewayConfig;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * Exposes the filesystem staging engine to CDI.
 */
public class StagingRepositoryProducer {

    private static final Logger LOG = Logger.getLogger(StagingRepositoryProducer.class);

    @Produces
    @Singleton
    LocalStagingRepository stagingRepository(GatewayConfig config) {
        LocalStagingRepository repository = config.staging().root()
                .map(root -> new LocalStagingRepository(Path.of(root), false))
                .orElseGet(LocalStagingRepository::createTemporary);
        LOG.infof("Staging root: %s", repository.root());
        return repository;
    }

    void close(@Disposes LocalStagingRepository repository) {
        repository.close();
    }
}
