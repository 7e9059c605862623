package ai.pipestream.staging.auth;

import jakarta.enterprise.context.RequestScoped;

/**
 * Request-scoped holder for the authenticated caller and their address.
 */
@RequestScoped
public class CallerContext {

    private IdentityContext identity;
    private String clientAddress;

    public void set(IdentityContext identity, String clientAddress) {
        this.identity = identity;
        this.clientAddress = clientAddress;
    }

    public IdentityContext identity() {
        if (identity == null) {
            throw new IllegalStateException("No authenticated caller for this request");
        }
        return identity;
    }

    public String clientAddress() {
        return clientAddress;
    }
}
