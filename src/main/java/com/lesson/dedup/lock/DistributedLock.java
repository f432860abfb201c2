package com.lesson.dedup.lock;

/**
 * Advisory lock keyed by lesson id. Transactions that touch the same lessons serialize on
 * these keys; transactions over disjoint lessons proceed independently.
 */
public interface DistributedLock {

    /**
     * Acquires the lock for {@code key}, waiting up to the configured timeout.
     *
     * @return true once held
     * @throws LockAcquisitionException if the lock could not be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases a lock held by the caller. Releasing an unheld key is a no-op.
     */
    void unlock(String key);
}
