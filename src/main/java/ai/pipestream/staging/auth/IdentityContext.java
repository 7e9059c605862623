package ai.pipestream.staging.auth;

import ai.pipestream.staging.repository.NamespaceAuthorization;

import java.util.List;

/**
 * The authenticated caller, attached to the request once the credential chain succeeds.
 *
 * @param userId     stable user id; the legacy username in pass-through mode
 * @param username   display name
 * @param namespaces namespaces the caller may stage into; empty in pass-through mode
 * @param credential what to forward to the publishing service
 * @param verified   whether the identity came from a verified assertion
 */
public record IdentityContext(String userId, String username, List<String> namespaces,
                              OutboundCredential credential, boolean verified) {

    public IdentityContext {
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
    }

    public static IdentityContext verified(String userId, String username, List<String> namespaces, String assertion) {
        return new IdentityContext(userId, username, namespaces, new OutboundCredential.SignedAssertion(assertion), true);
    }

    public static IdentityContext passThrough(LegacyUserToken token) {
        return new IdentityContext(token.username(), token.username(), List.of(),
                new OutboundCredential.LegacyToken(token), false);
    }

    /**
     * Repository owner; staging areas are partitioned by this value.
     */
    public String owner() {
        return userId;
    }

    public NamespaceAuthorization namespaceAuthorization() {
        return verified ? NamespaceAuthorization.of(namespaces) : NamespaceAuthorization.unrestricted();
    }
}
