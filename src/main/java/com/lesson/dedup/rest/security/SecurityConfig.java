package com.lesson.dedup.rest.security;

import com.lesson.dedup.security.Caller;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Maps API keys to caller identities.
 *
 * <p>A key only identifies who is calling. Whether that caller may review duplicates is
 * decided per operation by the permission gate, from the caller's current profile role.</p>
 *
 * <pre>
 * lesson-dedup.security.enabled=true
 * lesson-dedup.security.api-key-header=X-API-Key
 * lesson-dedup.security.user-keys=ld-ak-7f3a:user-42,ld-ak-91c0:user-77
 * lesson-dedup.security.service-keys=ld-sk-0d12:ingestion
 * </pre>
 */
public class SecurityConfig {

    private final boolean enabled;
    private final String apiKeyHeader;
    private final Map<String, Caller> apiKeys; // key value -> caller

    private SecurityConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.apiKeyHeader = builder.apiKeyHeader;
        this.apiKeys = Collections.unmodifiableMap(new HashMap<>(builder.apiKeys));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getApiKeyHeader() {
        return apiKeyHeader;
    }

    /**
     * Looks up the caller associated with an API key.
     *
     * @return the caller, or null if the key is not recognized
     */
    public Caller getCallerForKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        return apiKeys.get(apiKey);
    }

    public int keyCount() {
        return apiKeys.size();
    }

    public static SecurityConfig disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private String apiKeyHeader = "X-API-Key";
        private final Map<String, Caller> apiKeys = new HashMap<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder apiKeyHeader(String apiKeyHeader) {
            if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
                throw new IllegalArgumentException("apiKeyHeader must not be null or blank");
            }
            this.apiKeyHeader = apiKeyHeader;
            return this;
        }

        /**
         * Adds a key that authenticates as the given user.
         */
        public Builder addUserKey(String key, String userId) {
            return addKey(key, Caller.user(requireId(userId)));
        }

        /**
         * Adds a key that authenticates as a named service identity.
         */
        public Builder addServiceKey(String key, String serviceName) {
            return addKey(key, Caller.service(requireId(serviceName)));
        }

        /**
         * Adds keys written as {@code key:callerId} entries.
         */
        public Builder addUserKeys(List<String> entries) {
            forEachEntry(entries, this::addUserKey);
            return this;
        }

        public Builder addServiceKeys(List<String> entries) {
            forEachEntry(entries, this::addServiceKey);
            return this;
        }

        private Builder addKey(String key, Caller caller) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("API key must not be null or blank");
            }
            this.apiKeys.put(key, caller);
            return this;
        }

        private static void forEachEntry(List<String> entries, BiFunction<String, String, Builder> add) {
            if (entries == null) return;
            for (String entry : entries) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                int sep = entry.indexOf(':');
                if (sep <= 0 || sep == entry.length() - 1) {
                    throw new IllegalArgumentException("API key entry must look like key:callerId");
                }
                add.apply(entry.substring(0, sep).strip(), entry.substring(sep + 1).strip());
            }
        }

        private static String requireId(String id) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Caller id must not be null or blank");
            }
            return id;
        }

        public SecurityConfig build() {
            return new SecurityConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SecurityConfig{" +
                "enabled=" + enabled +
                ", apiKeyHeader='" + apiKeyHeader + '\'' +
                ", keyCount=" + apiKeys.size() +
                '}';
    }
}
