package com.lesson.dedup.lock;

import com.lesson.dedup.store.graph.GraphConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DistributedLockTest {

    @Nested
    @DisplayName("GraphDistributedLock")
    class GraphLockTests {

        @Test
        @DisplayName("Should create the lock index on construction")
        void testIndex() {
            GraphConnection connection = mock(GraphConnection.class);
            new GraphDistributedLock(connection);
            verify(connection).execute("CREATE INDEX FOR (l:Lock) ON (l.key)");
        }

        @Test
        @DisplayName("Should acquire when the graph reports this owner")
        void testAcquire() {
            GraphConnection connection = mock(GraphConnection.class);
            GraphDistributedLock lock = new GraphDistributedLock(connection);
            when(connection.query(contains("MERGE (l:Lock"), anyMap()))
                    .thenReturn(List.of(Map.of("owner", lock.ownerId())));

            assertTrue(lock.tryLock("lesson:a"));
        }

        @Test
        @DisplayName("Should retry and then fail while another owner holds the lock")
        void testContended() {
            GraphConnection connection = mock(GraphConnection.class);
            GraphDistributedLock lock = new GraphDistributedLock(connection, new LockConfig(1000, 2, 1, 30));
            when(connection.query(anyString(), anyMap())).thenReturn(List.of(Map.of("owner", "someone-else")));

            assertThrows(LockAcquisitionException.class, () -> lock.tryLock("lesson:a"));
            verify(connection, times(3)).query(anyString(), anyMap());
        }

        @Test
        @DisplayName("Should release only its own lock node")
        void testRelease() {
            GraphConnection connection = mock(GraphConnection.class);
            GraphDistributedLock lock = new GraphDistributedLock(connection);

            lock.unlock("lesson:a");

            verify(connection).execute(contains("MATCH (l:Lock {key: $key, owner: $owner})"),
                    eq(Map.of("key", "lesson:a", "owner", lock.ownerId())));
        }
    }

    @Nested
    @DisplayName("LockSet")
    class LockSetTests {

        private final List<String> events = new ArrayList<>();

        private DistributedLock recording(String failOn) {
            return new DistributedLock() {
                @Override
                public boolean tryLock(String key) {
                    if (key.equals(failOn)) {
                        throw new LockAcquisitionException("busy: " + key);
                    }
                    events.add("lock " + key);
                    return true;
                }

                @Override
                public void unlock(String key) {
                    events.add("unlock " + key);
                }
            };
        }

        @Test
        @DisplayName("Should lock in sorted order and release in reverse")
        void testOrdering() {
            try (LockSet set = LockSet.acquire(recording(null), List.of("c", "a", "b", "a"))) {
                assertEquals(3, set.size());
            }

            assertEquals(List.of("lock lesson:a", "lock lesson:b", "lock lesson:c",
                    "unlock lesson:c", "unlock lesson:b", "unlock lesson:a"), events);
        }

        @Test
        @DisplayName("Should release acquired locks when a later one fails")
        void testPartialFailure() {
            assertThrows(LockAcquisitionException.class,
                    () -> LockSet.acquire(recording("lesson:b"), List.of("a", "b", "c")));

            assertEquals(List.of("lock lesson:a", "unlock lesson:a"), events);
        }
    }

    @Nested
    @DisplayName("LockConfig")
    class LockConfigTests {

        @Test
        @DisplayName("Should create default config")
        void testDefaults() {
            LockConfig config = LockConfig.defaults();
            assertEquals(5000, config.timeoutMs());
            assertEquals(3, config.maxRetries());
            assertEquals(100, config.retryDelayMs());
            assertEquals(30, config.lockTtlSeconds());
        }

        @Test
        @DisplayName("Should reject invalid values")
        void testInvalid() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(0, 3, 100, 30));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(5000, -1, 100, 30));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(5000, 3, 100, 0));
        }
    }
}
