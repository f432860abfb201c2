package com.lesson.dedup.lock;

import com.lesson.dedup.store.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lesson lock shared between JVMs through a {@code :Lock} node in the graph.
 *
 * <p>A MERGE on the key either creates the node for this owner or, if an existing lock has
 * expired, takes it over. Locks left behind by a crashed process are reclaimed after the TTL.</p>
 */
public class GraphDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(GraphDistributedLock.class);

    private static final String ACQUIRE = """
            MERGE (l:Lock {key: $key})
            ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
            ON MATCH SET l.owner = CASE WHEN l.expiresAt < $now THEN $owner ELSE l.owner END,
                l.acquiredAt = CASE WHEN l.expiresAt < $now THEN $now ELSE l.acquiredAt END,
                l.expiresAt = CASE WHEN l.expiresAt < $now THEN $expiresAt ELSE l.expiresAt END
            RETURN l.owner AS owner
            """;

    private static final String RELEASE = """
            MATCH (l:Lock {key: $key, owner: $owner})
            DELETE l
            """;

    private final GraphConnection connection;
    private final LockConfig config;
    private final String ownerId;

    public GraphDistributedLock(GraphConnection connection) {
        this(connection, LockConfig.defaults());
    }

    public GraphDistributedLock(GraphConnection connection, LockConfig config) {
        this.connection = connection;
        this.config = config;
        this.ownerId = ProcessHandle.current().pid() + "-" + UUID.randomUUID();
        try {
            connection.execute("CREATE INDEX FOR (l:Lock) ON (l.key)");
        } catch (RuntimeException e) {
            log.debug("Lock index creation: {}", e.getMessage());
        }
    }

    @Override
    public boolean tryLock(String key) {
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (attemptLock(key)) {
                log.debug("lock.acquired key={} attempt={}", key, attempt + 1);
                return true;
            }
            if (attempt < config.maxRetries()) {
                try {
                    Thread.sleep(config.retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException("Interrupted while waiting for lesson lock " + key, e);
                }
            }
        }
        throw new LockAcquisitionException(
                "Lesson lock '" + key + "' not acquired after " + (config.maxRetries() + 1) + " attempts");
    }

    @Override
    public void unlock(String key) {
        try {
            connection.execute(RELEASE, Map.of("key", key, "owner", ownerId));
            log.debug("lock.released key={}", key);
        } catch (RuntimeException e) {
            log.warn("lock.release.failed key={} error={}", key, e.getMessage());
        }
    }

    String ownerId() {
        return ownerId;
    }

    private boolean attemptLock(String key) {
        Instant now = Instant.now();
        try {
            List<Map<String, Object>> rows = connection.query(ACQUIRE, Map.of(
                    "key", key,
                    "owner", ownerId,
                    "now", now.toString(),
                    "expiresAt", now.plusSeconds(config.lockTtlSeconds()).toString()));
            return !rows.isEmpty() && ownerId.equals(rows.get(0).get("owner"));
        } catch (RuntimeException e) {
            log.warn("lock.attempt.failed key={} error={}", key, e.getMessage());
            return false;
        }
    }
}
