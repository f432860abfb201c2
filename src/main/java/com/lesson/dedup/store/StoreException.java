package com.lesson.dedup.store;

/**
 * Infrastructure failure at the storage boundary. The enclosing transaction is rolled back
 * before this propagates to callers.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
