package com.lesson.dedup.store;

/**
 * Unit of work executed inside {@link ContentStore#inTransaction}.
 */
@FunctionalInterface
public interface StoreWork<T> {

    T execute(StoreSession session);
}
