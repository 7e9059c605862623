package ai.pipestream.staging.repository;

import java.io.InputStream;

/**
 * Staging areas keyed by {@link RepositoryKey}, each moving through
 * {@code OPEN -> CLOSED -> RELEASED}.
 * <p>
 * All methods block on storage and must be called from a worker thread.
 * Validation problems surface as {@link ai.pipestream.staging.exception.InvalidRequestException},
 * storage problems as {@link ai.pipestream.staging.exception.StagingStorageException}.
 */
public interface StagingRepository {

    /**
     * Open a new repository under a freshly allocated index.
     */
    RepositoryKey start(String ownerIdentity, String clientAddress, String namespace);

    /**
     * Return the caller's open no-profile repository, creating it when needed.
     * Repeated calls return the same key until that repository is finished.
     */
    RepositoryKey openWithoutNamespace(String ownerIdentity, String clientAddress);

    /**
     * Stream one file into an open repository.
     * <p>
     * Bytes are written as they arrive; an aborted stream leaves the partial file in place
     * and it will be part of the archive. Writing the same path concurrently for the same
     * key is not supported.
     *
     * @return number of bytes written
     */
    long addFile(NamespaceAuthorization authorization, RepositoryKey key, String relativePath, InputStream contents);

    /**
     * Package the staged files, delete them and mark the repository closed.
     */
    StagedArchive finish(RepositoryKey key);

    void release(RepositoryKey key);

    /**
     * Never throws for unknown or invalid keys; those read as {@link RepositoryState#NOT_FOUND}.
     */
    RepositoryState getState(RepositoryKey key);
}
