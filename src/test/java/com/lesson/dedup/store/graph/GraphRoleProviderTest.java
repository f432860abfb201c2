package com.lesson.dedup.store.graph;

import com.lesson.dedup.security.ProfileRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("GraphRoleProvider Tests")
class GraphRoleProviderTest {

    private final GraphConnection connection = mock(GraphConnection.class);
    private final GraphRoleProvider provider = new GraphRoleProvider(connection);

    @Test
    void readsRoleFromProfile() {
        when(connection.query(anyString(), eq(Map.of("userId", "u1"))))
                .thenReturn(List.of(Map.of("role", "reviewer")));

        assertEquals(Optional.of(ProfileRole.REVIEWER), provider.findRole("u1"));
    }

    @Test
    @DisplayName("Each call queries the graph again")
    void noCaching() {
        when(connection.query(anyString(), anyMap()))
                .thenReturn(List.of(Map.of("role", "admin")))
                .thenReturn(List.of(Map.of("role", "teacher")));

        assertEquals(Optional.of(ProfileRole.ADMIN), provider.findRole("u1"));
        assertEquals(Optional.of(ProfileRole.TEACHER), provider.findRole("u1"));
    }

    @Test
    void missingOrUnknownRoleIsEmpty() {
        when(connection.query(anyString(), anyMap()))
                .thenReturn(List.of())
                .thenReturn(List.of(Map.of("role", "gardener")));

        assertTrue(provider.findRole("u1").isEmpty());
        assertTrue(provider.findRole("u1").isEmpty());
        assertTrue(provider.findRole(" ").isEmpty());
    }
}
