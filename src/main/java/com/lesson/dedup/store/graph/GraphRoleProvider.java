package com.lesson.dedup.store.graph;

import com.lesson.dedup.security.ProfileRole;
import com.lesson.dedup.security.RoleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads user roles from {@code :UserProfile} nodes.
 */
public class GraphRoleProvider implements RoleProvider {
    private static final Logger log = LoggerFactory.getLogger(GraphRoleProvider.class);

    private final GraphConnection connection;

    public GraphRoleProvider(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Optional<ProfileRole> findRole(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        List<Map<String, Object>> rows = connection.query(
                "MATCH (p:UserProfile {userId: $userId}) RETURN p.role AS role",
                Map.of("userId", userId));
        if (rows.isEmpty() || rows.get(0).get("role") == null) {
            return Optional.empty();
        }
        String role = rows.get(0).get("role").toString();
        try {
            return Optional.of(ProfileRole.fromString(role));
        } catch (IllegalArgumentException e) {
            log.warn("profile.role.unknown userId={} role={}", userId, role);
            return Optional.empty();
        }
    }
}
