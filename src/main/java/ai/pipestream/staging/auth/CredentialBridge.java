package ai.pipestream.staging.auth;

import ai.pipestream.staging.config.GatewayConfig;
import ai.pipestream.staging.exception.AuthenticationException;
import ai.pipestream.staging.exception.AuthenticationException.Reason;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * Turns an inbound {@code Authorization} header into an {@link IdentityContext}.
 * <p>
 * Basic tokens (and Bearer tokens that are not assertions) are decoded as legacy user tokens
 * and exchanged for a signed assertion, which is then verified. Bearer assertions are verified
 * directly. With identity disabled the decoded legacy token is passed through unverified.
 * Every failure is an {@link AuthenticationException}.
 */
@ApplicationScoped
public class CredentialBridge {

    private static final Logger LOG = Logger.getLogger(CredentialBridge.class);

    @Inject
    GatewayConfig config;

    @Inject
    IdentityExchangeClient exchangeClient;

    private AssertionVerifier verifier;

    public CredentialBridge() {
    }

    /**
     * @param verifier null for pass-through mode
     */
    CredentialBridge(IdentityExchangeClient exchangeClient, AssertionVerifier verifier) {
        this.exchangeClient = exchangeClient;
        this.verifier = verifier;
    }

    @PostConstruct
    void init() {
        if (!config.identity().enabled()) {
            LOG.info("Identity exchange disabled; legacy tokens are forwarded as-is");
            return;
        }
        Path keyFile = config.identity().publicKeyLocation()
                .map(Path::of)
                .orElseThrow(() -> new IllegalStateException(
                        "gateway.identity.public-key-location is required when identity is enabled"));
        verifier = new AssertionVerifier(AssertionVerifier.loadPublicKey(keyFile),
                config.identity().issuer(), config.identity().audience(), config.identity().clockSkew());
        LOG.infof("Identity exchange enabled: issuer=%s, audience=%s",
                config.identity().issuer(), config.identity().audience());
    }

    public Uni<IdentityContext> authenticate(String rawHeader) {
        return Uni.createFrom().item(() -> AuthorizationHeader.parse(rawHeader))
                .onItem().transformToUni(this::authenticate);
    }

    Uni<IdentityContext> authenticate(AuthorizationHeader header) {
        if (verifier != null && header.scheme() == AuthorizationHeader.Scheme.BEARER && looksLikeAssertion(header.token())) {
            return Uni.createFrom().item(() -> verifier.verify(header.token()));
        }
        return Uni.createFrom().item(() -> LegacyUserToken.decode(header.token()))
                .onItem().transformToUni(this::exchangeAndVerify);
    }

    private Uni<IdentityContext> exchangeAndVerify(LegacyUserToken token) {
        if (verifier == null) {
            return Uni.createFrom().item(IdentityContext.passThrough(token));
        }
        return exchangeClient.exchange(token)
                .onFailure(e -> !(e instanceof AuthenticationException))
                .transform(e -> new AuthenticationException(Reason.EXCHANGE_FAILED,
                        "Token exchange failed for " + token.username() + ": " + e.getMessage(), e))
                .map(verifier::verify);
    }

    private static boolean looksLikeAssertion(String token) {
        return token.split("\\.", -1).length == 3;
    }
}
