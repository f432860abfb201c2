package com.lesson.dedup.cdi;

import com.lesson.dedup.api.DuplicateOptions;
import com.lesson.dedup.rest.security.ApiKeyAuthFilter;
import com.lesson.dedup.rest.security.SecurityConfig;
import com.lesson.dedup.security.Caller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DuplicateResolutionProducer Tests")
class DuplicateResolutionProducerTest {

    private DuplicateResolutionProducer producer;

    @BeforeEach
    void setUp() {
        producer = new DuplicateResolutionProducer();
        producer.similarityThreshold = 0.9;
        producer.embeddingDimension = 768;
        producer.sentinelTitle = "Untitled";
        producer.tableMarker = "[Table]";
        producer.previewLength = 120;
        producer.archiveReason = "duplicate_resolution";
        producer.trustedServices = Optional.of(List.of("ingestion"));
        producer.cacheEnabled = true;
        producer.cacheTtlSeconds = 10;
        producer.securityEnabled = true;
        producer.apiKeyHeader = "X-API-Key";
        producer.userKeys = Optional.of(List.of("ld-ak-7f3a:user-42"));
        producer.serviceKeys = Optional.empty();
    }

    @Test
    @DisplayName("Config properties flow into resolver options")
    void optionsFromConfig() {
        DuplicateOptions options = producer.options();

        assertEquals(0.9, options.getSimilarityThreshold());
        assertEquals(768, options.getEmbeddingDimension());
        assertEquals("Untitled", options.getSentinelTitle());
        assertEquals(120, options.getPreviewLength());
        assertTrue(options.isCacheEnabled());
        assertEquals(10, options.getCacheTtlSeconds());
        assertEquals(Set.of("ingestion"), options.getTrustedServices());
    }

    @Test
    @DisplayName("Missing trusted services mean none")
    void noTrustedServices() {
        producer.trustedServices = Optional.empty();
        assertTrue(producer.options().getTrustedServices().isEmpty());
    }

    @Test
    @DisplayName("Security config is built from key entries")
    void securityConfig() {
        SecurityConfig config = producer.securityConfig();

        assertTrue(config.isEnabled());
        assertEquals(1, config.keyCount());
        assertEquals(Caller.user("user-42"), config.getCallerForKey("ld-ak-7f3a"));
        assertNotNull(producer.apiKeyAuthFilter(config));
        assertInstanceOf(ApiKeyAuthFilter.class, producer.apiKeyAuthFilter(config));
    }
}
