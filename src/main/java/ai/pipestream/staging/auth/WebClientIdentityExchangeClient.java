package ai.pipestream.staging.auth;

import ai.pipestream.staging.config.GatewayConfig;
import ai.pipestream.staging.exception.UpstreamException;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Posts the legacy token as Basic credentials to the identity service; the 2xx response
 * body is the assertion.
 */
@ApplicationScoped
public class WebClientIdentityExchangeClient implements IdentityExchangeClient {

    private static final Logger LOG = Logger.getLogger(WebClientIdentityExchangeClient.class);

    @Inject
    WebClient webClient;

    @Inject
    GatewayConfig config;

    @Override
    public Uni<String> exchange(LegacyUserToken token) {
        String url = config.identity().exchangeUrl()
                .orElseThrow(() -> new IllegalStateException("gateway.identity.exchange-url is not configured"));
        LOG.debugf("Exchanging token for %s at %s", token.username(), url);
        return webClient.postAbs(url)
                .putHeader("Authorization", "Basic " + token.encoded())
                .putHeader("Accept", "text/plain, application/jwt")
                .send()
                .onFailure().transform(e -> new UpstreamException("identityExchange", "Identity service unreachable", e))
                .map(response -> {
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new UpstreamException("identityExchange", response.statusCode(),
                                "Identity service refused token for " + token.username());
                    }
                    String body = response.bodyAsString();
                    if (body == null || body.isBlank()) {
                        throw new UpstreamException("identityExchange", response.statusCode(), "Empty assertion");
                    }
                    return body.trim();
                });
    }
}
