package ai.pipestream.staging.repository;

import ai.pipestream.staging.exception.InvalidRequestException;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks the highest sequence index handed out per {@code (owner, address, namespace)}.
 * <p>
 * Allocation takes the write lock, validation the read lock. Neither is held
 * across filesystem work.
 */
public class RepositoryIndexAllocator {

    private record IndexKey(String ownerIdentity, String clientAddress, String namespace) {
        static IndexKey of(RepositoryKey key) {
            return new IndexKey(key.ownerIdentity(), key.addressOrDefault(), key.namespace());
        }
    }

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<IndexKey, Integer> highest = new HashMap<>();

    /**
     * Allocate a fresh index for the triple. The first allocation is 0.
     */
    public RepositoryKey allocate(String ownerIdentity, String clientAddress, String namespace) {
        RepositoryKey template = new RepositoryKey(ownerIdentity, clientAddress, namespace, 0);
        IndexKey indexKey = IndexKey.of(template);
        int next;
        lock.writeLock().lock();
        try {
            Integer current = highest.get(indexKey);
            next = current == null ? 0 : current + 1;
            highest.put(indexKey, next);
        } finally {
            lock.writeLock().unlock();
        }
        return new RepositoryKey(ownerIdentity, clientAddress, template.namespace(), next);
    }

    /**
     * The current no-profile key for the caller, allocating index 0 on first use.
     */
    public RepositoryKey current(String ownerIdentity, String clientAddress) {
        RepositoryKey template = new RepositoryKey(ownerIdentity, clientAddress, null, 0);
        int index;
        lock.writeLock().lock();
        try {
            index = highest.computeIfAbsent(IndexKey.of(template), k -> 0);
        } finally {
            lock.writeLock().unlock();
        }
        return new RepositoryKey(ownerIdentity, clientAddress, null, index);
    }

    /**
     * Move past {@code stale} if it is still the highest index for its triple.
     * Concurrent callers that observed the same stale key advance it only once.
     *
     * @return the key now current for the triple
     */
    public RepositoryKey advancePast(RepositoryKey stale) {
        IndexKey indexKey = IndexKey.of(stale);
        int index;
        lock.writeLock().lock();
        try {
            index = highest.merge(indexKey, stale.sequenceIndex() + 1,
                    (current, proposed) -> current == stale.sequenceIndex() ? proposed : current);
        } finally {
            lock.writeLock().unlock();
        }
        return new RepositoryKey(stale.ownerIdentity(), stale.clientAddress(), stale.namespace(), index);
    }

    /**
     * Reject keys this allocator never handed out.
     *
     * @throws InvalidRequestException if no index exists for the triple or the key's index is beyond it
     */
    public void validate(String operation, RepositoryKey key) {
        Integer current;
        lock.readLock().lock();
        try {
            current = highest.get(IndexKey.of(key));
        } finally {
            lock.readLock().unlock();
        }
        if (current == null || key.sequenceIndex() > current) {
            throw InvalidRequestException.unknownRepository(operation, key);
        }
    }
}
