package com.lesson.dedup.metrics;

import com.lesson.dedup.resolution.ErrorCategory;

import java.time.Duration;

/**
 * Records duplicate detection and resolution metrics.
 * {@link NoOpMetricsService} is the default when no registry is configured.
 */
public interface MetricsService {

    void recordDetection(int pairCount, Duration duration);

    void incrementArchived(int count);

    void incrementMerged();

    void incrementDismissed();

    void incrementFailure(String operation, ErrorCategory category);

    void recordCacheHit();

    void recordCacheMiss();
}
