package com.lesson.dedup.metrics;

import com.lesson.dedup.resolution.ErrorCategory;

import java.time.Duration;

/**
 * Metrics service that records nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDetection(int pairCount, Duration duration) {
    }

    @Override
    public void incrementArchived(int count) {
    }

    @Override
    public void incrementMerged() {
    }

    @Override
    public void incrementDismissed() {
    }

    @Override
    public void incrementFailure(String operation, ErrorCategory category) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
