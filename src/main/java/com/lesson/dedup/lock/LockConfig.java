package com.lesson.dedup.lock;

/**
 * Lock tuning.
 *
 * @param timeoutMs      maximum wait for an in-process lock
 * @param maxRetries     retries for graph locks held by another owner
 * @param retryDelayMs   pause between graph lock attempts
 * @param lockTtlSeconds expiry of graph lock nodes, after which they may be reclaimed
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs, int lockTtlSeconds) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
        if (lockTtlSeconds <= 0) {
            throw new IllegalArgumentException("lockTtlSeconds must be > 0");
        }
    }

    /**
     * 5s timeout, 3 retries, 100ms delay, 30s TTL.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 3, 100, 30);
    }
}
