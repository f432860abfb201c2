package com.lesson.dedup.cdi;

import com.lesson.dedup.api.DuplicateOptions;
import com.lesson.dedup.api.DuplicateResolver;
import com.lesson.dedup.lock.LockConfig;
import com.lesson.dedup.metrics.MicrometerMetricsService;
import com.lesson.dedup.rest.security.ApiKeyAuthFilter;
import com.lesson.dedup.rest.security.SecurityConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * CDI producer that wires the duplicate review service from MicroProfile Config properties.
 *
 * <p>At minimum the FalkorDB connection must be configured:</p>
 * <pre>
 * lesson-dedup.falkordb.host=localhost
 * lesson-dedup.falkordb.port=6379
 * lesson-dedup.falkordb.graph-name=lessons
 * </pre>
 *
 * <p>Profile roles are read from {@code UserProfile} nodes in the same graph. When the
 * container provides a Micrometer {@link MeterRegistry}, metrics are published to it.</p>
 */
@ApplicationScoped
public class DuplicateResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(DuplicateResolutionProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lesson-dedup.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "lesson-dedup.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "lesson-dedup.falkordb.graph-name", defaultValue = "lessons")
    String falkordbGraphName;

    // ── Detection ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lesson-dedup.detection.similarity-threshold", defaultValue = "0.95")
    double similarityThreshold;

    @Inject
    @ConfigProperty(name = "lesson-dedup.detection.embedding-dimension", defaultValue = "1536")
    int embeddingDimension;

    @Inject
    @ConfigProperty(name = "lesson-dedup.detection.sentinel-title", defaultValue = "Unknown")
    String sentinelTitle;

    // ── Review ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lesson-dedup.review.table-marker", defaultValue = "|")
    String tableMarker;

    @Inject
    @ConfigProperty(name = "lesson-dedup.review.preview-length", defaultValue = "500")
    int previewLength;

    @Inject
    @ConfigProperty(name = "lesson-dedup.resolution.archive-reason", defaultValue = "duplicate_resolution")
    String archiveReason;

    @Inject
    @ConfigProperty(name = "lesson-dedup.resolution.trusted-services")
    Optional<List<String>> trustedServices;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lesson-dedup.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "lesson-dedup.cache.ttl-seconds", defaultValue = "30")
    long cacheTtlSeconds;

    // ── Locks ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lesson-dedup.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "lesson-dedup.lock.max-retries", defaultValue = "3")
    int lockMaxRetries;

    @Inject
    @ConfigProperty(name = "lesson-dedup.lock.retry-delay-ms", defaultValue = "100")
    long lockRetryDelayMs;

    @Inject
    @ConfigProperty(name = "lesson-dedup.lock.ttl-seconds", defaultValue = "30")
    int lockTtlSeconds;

    // ── Security ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lesson-dedup.security.enabled", defaultValue = "true")
    boolean securityEnabled;

    @Inject
    @ConfigProperty(name = "lesson-dedup.security.api-key-header", defaultValue = "X-API-Key")
    String apiKeyHeader;

    @Inject
    @ConfigProperty(name = "lesson-dedup.security.user-keys")
    Optional<List<String>> userKeys;

    @Inject
    @ConfigProperty(name = "lesson-dedup.security.service-keys")
    Optional<List<String>> serviceKeys;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public DuplicateResolver duplicateResolver() {
        log.info("Producing DuplicateResolver: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);

        DuplicateResolver.Builder builder = DuplicateResolver.builder()
                .falkorDB(falkordbHost, falkordbPort, falkordbGraphName)
                .options(options())
                .lockConfig(new LockConfig(lockTimeoutMs, lockMaxRetries, lockRetryDelayMs, lockTtlSeconds));

        if (meterRegistry != null && meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Micrometer metrics enabled");
        } else {
            log.info("No MeterRegistry available, metrics disabled");
        }

        return builder.build();
    }

    public void closeResolver(@Disposes DuplicateResolver resolver) {
        log.info("Closing DuplicateResolver");
        resolver.close();
    }

    @Produces
    @ApplicationScoped
    public SecurityConfig securityConfig() {
        SecurityConfig.Builder builder = SecurityConfig.builder()
                .enabled(securityEnabled)
                .apiKeyHeader(apiKeyHeader);

        userKeys.ifPresent(builder::addUserKeys);
        serviceKeys.ifPresent(builder::addServiceKeys);

        SecurityConfig config = builder.build();
        log.info("Security config: enabled={} keyCount={}", config.isEnabled(), config.keyCount());
        return config;
    }

    @Produces
    @ApplicationScoped
    public ApiKeyAuthFilter apiKeyAuthFilter(SecurityConfig config) {
        return new ApiKeyAuthFilter(config);
    }

    DuplicateOptions options() {
        return DuplicateOptions.builder()
                .similarityThreshold(similarityThreshold)
                .embeddingDimension(embeddingDimension)
                .sentinelTitle(sentinelTitle)
                .tableMarker(tableMarker)
                .previewLength(previewLength)
                .archiveReason(archiveReason)
                .cacheEnabled(cacheEnabled)
                .cacheTtlSeconds(cacheTtlSeconds)
                .trustedServices(trustedServices.map(Set::copyOf).orElse(Set.of()))
                .build();
    }
}
