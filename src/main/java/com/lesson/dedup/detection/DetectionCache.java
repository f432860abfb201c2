package com.lesson.dedup.detection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lesson.dedup.core.model.DuplicatePair;
import com.lesson.dedup.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Short-lived cache of the pair scan. Pair detection is a full quadratic pass over the
 * store, so repeated reads within the TTL reuse the last result. Every committed mutation
 * must call {@link #invalidate()}.
 */
public class DetectionCache {
    private static final Logger log = LoggerFactory.getLogger(DetectionCache.class);
    private static final String PAIRS_KEY = "pairs";

    private final Cache<String, Snapshot> cache;
    private final MetricsService metrics;
    // bumped on invalidation; a snapshot taken under an older generation is never served
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();

    public DetectionCache(Duration ttl, MetricsService metrics) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .build();
        this.metrics = metrics;
        log.info("DetectionCache initialized: ttl={}s", ttl.toSeconds());
    }

    /**
     * Returns the cached pairs or computes and caches them. A scan that overlaps an
     * invalidation is returned to its caller but never served to later ones.
     */
    public List<DuplicatePair> pairs(Supplier<List<DuplicatePair>> scan) {
        long current = generation.get();
        Snapshot cached = cache.getIfPresent(PAIRS_KEY);
        if (cached != null && cached.generation() == current) {
            hits.incrementAndGet();
            metrics.recordCacheHit();
            return cached.pairs();
        }
        metrics.recordCacheMiss();
        List<DuplicatePair> computed = List.copyOf(scan.get());
        Snapshot fresh = new Snapshot(current, computed);
        cache.put(PAIRS_KEY, fresh);
        if (generation.get() != current) {
            // invalidated while scanning or storing
            cache.asMap().remove(PAIRS_KEY, fresh);
        }
        return computed;
    }

    public void invalidate() {
        generation.incrementAndGet();
        cache.invalidateAll();
        log.debug("detection.cache.invalidated");
    }

    /**
     * Number of reads served from a current snapshot.
     */
    public long hitCount() {
        return hits.get();
    }

    private record Snapshot(long generation, List<DuplicatePair> pairs) {
    }
}
