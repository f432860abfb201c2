package com.lesson.dedup.detection;

import com.lesson.dedup.core.model.DetectionMethod;
import com.lesson.dedup.core.model.DuplicatePair;
import com.lesson.dedup.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("DetectionCache Tests")
class DetectionCacheTest {

    private final MetricsService metrics = mock(MetricsService.class);
    private final DetectionCache cache = new DetectionCache(Duration.ofMinutes(5), metrics);
    private final List<DuplicatePair> pairs = List.of(
            new DuplicatePair("a", "b", "A", "a", null, DetectionMethod.SAME_TITLE));

    @Test
    @DisplayName("Second read within the TTL reuses the scan")
    void cachesScan() {
        AtomicInteger scans = new AtomicInteger();

        cache.pairs(() -> { scans.incrementAndGet(); return pairs; });
        List<DuplicatePair> second = cache.pairs(() -> { scans.incrementAndGet(); return pairs; });

        assertEquals(1, scans.get());
        assertEquals(pairs, second);
        assertEquals(1, cache.hitCount());
        verify(metrics).recordCacheMiss();
        verify(metrics).recordCacheHit();
    }

    @Test
    @DisplayName("Invalidation forces a fresh scan")
    void invalidate() {
        AtomicInteger scans = new AtomicInteger();
        cache.pairs(() -> { scans.incrementAndGet(); return pairs; });

        cache.invalidate();
        cache.pairs(() -> { scans.incrementAndGet(); return List.of(); });

        assertEquals(2, scans.get());
    }

    @Test
    @DisplayName("A scan that overlaps an invalidation is returned but not cached")
    void racingScanNotCached() {
        AtomicInteger scans = new AtomicInteger();

        List<DuplicatePair> first = cache.pairs(() -> {
            scans.incrementAndGet();
            cache.invalidate();
            return pairs;
        });
        cache.pairs(() -> { scans.incrementAndGet(); return pairs; });

        assertEquals(pairs, first);
        assertEquals(2, scans.get());
    }

    @Test
    @DisplayName("A result stored after a concurrent invalidation is discarded and the next scan is cached")
    void staleResultDiscarded() {
        AtomicInteger scans = new AtomicInteger();
        List<DuplicatePair> fresh = List.of();

        cache.pairs(() -> {
            scans.incrementAndGet();
            cache.invalidate();
            return pairs;
        });
        List<DuplicatePair> second = cache.pairs(() -> { scans.incrementAndGet(); return fresh; });
        List<DuplicatePair> third = cache.pairs(() -> { scans.incrementAndGet(); return pairs; });

        assertEquals(2, scans.get());
        assertEquals(fresh, second);
        assertEquals(fresh, third);
        assertEquals(1, cache.hitCount());
    }

    @Test
    @DisplayName("Readers racing with invalidations never see a scan older than the last invalidation")
    void concurrentInvalidation() throws Exception {
        AtomicInteger version = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                readers.add(pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        cache.pairs(() -> List.of(new DuplicatePair("v" + version.get(), "b", "A", "a", null,
                                DetectionMethod.SAME_TITLE)));
                    }
                }));
            }
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    version.incrementAndGet();
                    cache.invalidate();
                }
            });
            writer.get(10, TimeUnit.SECONDS);
            for (Future<?> reader : readers) {
                reader.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        String latest = "v" + version.get();
        assertEquals(latest, cache.pairs(() -> List.of(new DuplicatePair(latest, "b", "A", "a", null,
                DetectionMethod.SAME_TITLE))).get(0).lessonId1());
    }
}
