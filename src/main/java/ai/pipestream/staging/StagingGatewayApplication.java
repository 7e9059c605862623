package ai.pipestream.staging;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Entry point for the staging gateway: accepts legacy staging uploads and forwards
 * finished bundles to the publishing service.
 */
@QuarkusMain
@ApplicationScoped
public class StagingGatewayApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(StagingGatewayApplication.class);

    public static void main(String... args) {
        Quarkus.run(StagingGatewayApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Staging gateway started");
        Quarkus.waitForExit();
        return 0;
    }
}
