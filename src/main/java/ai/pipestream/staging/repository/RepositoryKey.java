package ai.pipestream.staging.repository;

import ai.pipestream.staging.exception.InvalidRequestException;

import java.util.Objects;

/**
 * Identifies one staging session.
 * <p>
 * The public repository id handed to build clients is {@code {namespace}-{sequenceIndex}};
 * the owner and client address are implied by the caller and never travel on the wire.
 * A missing namespace is stored as {@link #NO_PROFILE} so that keys built from a parsed
 * repository id compare equal to the key that produced it.
 */
public record RepositoryKey(String ownerIdentity, String clientAddress, String namespace, int sequenceIndex) {

    /**
     * Namespace used for deployments that do not declare a staging profile.
     */
    public static final String NO_PROFILE = "no-profile";

    /**
     * Directory and index component used when the client address is unknown.
     */
    public static final String UNKNOWN_ADDRESS = "unknown-address";

    public RepositoryKey {
        Objects.requireNonNull(ownerIdentity, "ownerIdentity must not be null");
        if (namespace == null || namespace.isBlank()) {
            namespace = NO_PROFILE;
        }
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex must not be negative: " + sequenceIndex);
        }
    }

    /**
     * Rebuilds the key for a repository id previously returned to this caller.
     *
     * @param ownerIdentity the authenticated caller
     * @param clientAddress the caller's address, may be null
     * @param repositoryId  the public id, {@code {namespace}-{index}}
     * @return the key
     * @throws InvalidRequestException if the id has no {@code -} or the suffix is not an unsigned integer
     */
    public static RepositoryKey fromRepositoryId(String ownerIdentity, String clientAddress, String repositoryId) {
        if (repositoryId == null) {
            throw InvalidRequestException.invalidRepositoryId("parseRepositoryId", null);
        }
        int separator = repositoryId.lastIndexOf('-');
        if (separator <= 0 || separator == repositoryId.length() - 1) {
            throw InvalidRequestException.invalidRepositoryId("parseRepositoryId", repositoryId);
        }
        String namespace = repositoryId.substring(0, separator);
        String suffix = repositoryId.substring(separator + 1);
        if (!suffix.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw InvalidRequestException.invalidRepositoryId("parseRepositoryId", repositoryId);
        }
        try {
            return new RepositoryKey(ownerIdentity, clientAddress, namespace, Integer.parseInt(suffix));
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("parseRepositoryId", "Invalid repository id: " + repositoryId, e);
        }
    }

    public String repositoryId() {
        return namespace + "-" + sequenceIndex;
    }

    public boolean hasNamespace() {
        return !NO_PROFILE.equals(namespace);
    }

    public String addressOrDefault() {
        return clientAddress == null || clientAddress.isBlank() ? UNKNOWN_ADDRESS : clientAddress;
    }

    @Override
    public String toString() {
        return ownerIdentity + "/" + addressOrDefault() + "/" + repositoryId();
    }
}
