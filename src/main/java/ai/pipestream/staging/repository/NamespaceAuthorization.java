package ai.pipestream.staging.repository;

import ai.pipestream.staging.exception.InvalidRequestException;

import java.util.List;

/**
 * The namespaces a caller may stage into.
 * A namespace is covered when it equals an authorized namespace or is a
 * dot-separated child of one ({@code com.example.tools} under {@code com.example}).
 */
public final class NamespaceAuthorization {

    private static final NamespaceAuthorization UNRESTRICTED = new NamespaceAuthorization(null);

    private final List<String> namespaces;

    private NamespaceAuthorization(List<String> namespaces) {
        this.namespaces = namespaces;
    }

    /**
     * No gateway-side scoping; the publishing service validates namespaces itself.
     */
    public static NamespaceAuthorization unrestricted() {
        return UNRESTRICTED;
    }

    public static NamespaceAuthorization of(List<String> namespaces) {
        return new NamespaceAuthorization(namespaces == null ? List.of() : List.copyOf(namespaces));
    }

    public boolean isUnrestricted() {
        return namespaces == null;
    }

    public boolean covers(String namespace) {
        if (isUnrestricted()) {
            return true;
        }
        if (namespace == null || namespace.isBlank()) {
            return false;
        }
        for (String authorized : namespaces) {
            if (namespace.equals(authorized) || namespace.startsWith(authorized + ".")) {
                return true;
            }
        }
        return false;
    }

    public void requireNamespace(String operation, String namespace) {
        if (!covers(namespace)) {
            throw InvalidRequestException.namespaceNotAuthorized(operation, namespace);
        }
    }

    /**
     * Checks a file about to be staged. Namespaced repositories are checked by their
     * namespace; no-profile repositories by the group directories leading the file path.
     */
    public void requireFile(String operation, RepositoryKey key, String relativePath) {
        if (isUnrestricted()) {
            return;
        }
        if (key.hasNamespace()) {
            requireNamespace(operation, key.namespace());
            return;
        }
        String path = relativePath == null ? "" : relativePath.replace('\\', '/');
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        for (String authorized : namespaces) {
            if (path.startsWith(authorized.replace('.', '/') + "/")) {
                return;
            }
        }
        throw InvalidRequestException.namespaceNotAuthorized(operation, relativePath);
    }

    @Override
    public String toString() {
        return isUnrestricted() ? "unrestricted" : namespaces.toString();
    }
}
