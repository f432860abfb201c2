package com.lesson.dedup.security;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable in-memory role table.
 */
public class InMemoryRoleProvider implements RoleProvider {

    private final Map<String, ProfileRole> roles = new ConcurrentHashMap<>();

    public InMemoryRoleProvider assign(String userId, ProfileRole role) {
        roles.put(userId, role);
        return this;
    }

    public void revoke(String userId) {
        roles.remove(userId);
    }

    @Override
    public Optional<ProfileRole> findRole(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(roles.get(userId));
    }
}
