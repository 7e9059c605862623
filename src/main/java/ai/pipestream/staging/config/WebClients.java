package ai.pipestream.staging.config;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Shared outbound HTTP client for the identity and publishing services.
 */
public class WebClients {

    @Produces
    @Singleton
    WebClient webClient(Vertx vertx) {
        return WebClient.create(vertx);
    }

    void close(@Disposes WebClient webClient) {
        webClient.close();
    }
}
