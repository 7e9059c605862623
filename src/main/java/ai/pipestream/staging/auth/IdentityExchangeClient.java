package ai.pipestream.staging.auth;

import io.smallrye.mutiny.Uni;

/**
 * Trades a legacy user token for a signed identity assertion.
 */
public interface IdentityExchangeClient {

    /**
     * @return the compact serialized assertion
     */
    Uni<String> exchange(LegacyUserToken token);
}
