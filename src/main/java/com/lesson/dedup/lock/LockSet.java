package com.lesson.dedup.lock;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;

/**
 * Holds the locks of several lessons at once. Keys are acquired in sorted order so two
 * transactions over overlapping lesson sets cannot deadlock, and released in reverse.
 */
public final class LockSet implements AutoCloseable {
    private static final String KEY_PREFIX = "lesson:";

    private final DistributedLock lock;
    private final Deque<String> held = new ArrayDeque<>();

    private LockSet(DistributedLock lock) {
        this.lock = lock;
    }

    /**
     * Locks every lesson id. If any acquisition fails, the locks already taken are released
     * before the exception propagates.
     */
    public static LockSet acquire(DistributedLock lock, Collection<String> lessonIds) {
        LockSet set = new LockSet(lock);
        try {
            for (String id : new TreeSet<>(lessonIds)) {
                String key = KEY_PREFIX + id;
                lock.tryLock(key);
                set.held.push(key);
            }
            return set;
        } catch (RuntimeException e) {
            set.close();
            throw e;
        }
    }

    public int size() {
        return held.size();
    }

    @Override
    public void close() {
        while (!held.isEmpty()) {
            lock.unlock(held.pop());
        }
    }
}
