package ai.pipestream.staging.auth;

/**
 * What the gateway presents to the publishing service on the caller's behalf.
 */
public interface OutboundCredential {

    String bearerToken();

    default String authorizationHeader() {
        return "Bearer " + bearerToken();
    }

    /**
     * The caller's own legacy token, re-encoded.
     */
    record LegacyToken(LegacyUserToken token) implements OutboundCredential {
        @Override
        public String bearerToken() {
            return token.encoded();
        }

        @Override
        public String toString() {
            return "LegacyToken{" + token.username() + "}";
        }
    }

    /**
     * A verified assertion from the identity service.
     */
    record SignedAssertion(String jwt) implements OutboundCredential {
        @Override
        public String bearerToken() {
            return jwt;
        }

        @Override
        public String toString() {
            return "SignedAssertion{<redacted>}";
        }
    }
}
