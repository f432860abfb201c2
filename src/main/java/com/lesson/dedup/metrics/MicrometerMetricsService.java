package com.lesson.dedup.metrics;

import com.lesson.dedup.resolution.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code lesson.dedup.detection.duration} (Timer)</li>
 *   <li>{@code lesson.dedup.pairs.found} (DistributionSummary)</li>
 *   <li>{@code lesson.dedup.archived}, {@code lesson.dedup.merged}, {@code lesson.dedup.dismissed} (Counters)</li>
 *   <li>{@code lesson.dedup.operation.failed} (Counter, tags: operation, category)</li>
 *   <li>{@code lesson.dedup.cache.hit}, {@code lesson.dedup.cache.miss} (Counters)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final Timer detectionTimer;
    private final DistributionSummary pairsFound;
    private final Counter archivedCounter;
    private final Counter mergedCounter;
    private final Counter dismissedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.detectionTimer = Timer.builder("lesson.dedup.detection.duration")
                .description("Duration of a full duplicate pair scan")
                .register(registry);
        this.pairsFound = DistributionSummary.builder("lesson.dedup.pairs.found")
                .description("Number of candidate pairs per scan")
                .register(registry);
        this.archivedCounter = Counter.builder("lesson.dedup.archived")
                .description("Lessons archived as duplicates")
                .register(registry);
        this.mergedCounter = Counter.builder("lesson.dedup.merged")
                .description("Metadata merges into a canonical lesson")
                .register(registry);
        this.dismissedCounter = Counter.builder("lesson.dedup.dismissed")
                .description("Duplicate groups dismissed as distinct")
                .register(registry);
        this.cacheHitCounter = Counter.builder("lesson.dedup.cache.hit")
                .description("Detection cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("lesson.dedup.cache.miss")
                .description("Detection cache misses")
                .register(registry);
    }

    @Override
    public void recordDetection(int pairCount, Duration duration) {
        detectionTimer.record(duration);
        pairsFound.record(pairCount);
    }

    @Override
    public void incrementArchived(int count) {
        archivedCounter.increment(count);
    }

    @Override
    public void incrementMerged() {
        mergedCounter.increment();
    }

    @Override
    public void incrementDismissed() {
        dismissedCounter.increment();
    }

    @Override
    public void incrementFailure(String operation, ErrorCategory category) {
        String key = operation + ":" + category.name();
        failureCounters.computeIfAbsent(key, k ->
                Counter.builder("lesson.dedup.operation.failed")
                        .description("Failed duplicate resolution operations")
                        .tag("operation", operation)
                        .tag("category", category.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
