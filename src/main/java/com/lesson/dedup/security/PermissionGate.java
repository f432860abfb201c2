package com.lesson.dedup.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a caller may review and resolve duplicates.
 *
 * <p>Service callers pass when their name is one of the configured trusted identities.
 * Users pass only if their profile role, read fresh from the {@link RoleProvider} on each
 * call, is reviewer, admin or super_admin. Any failure to determine the role denies.</p>
 */
public class PermissionGate {
    private static final Logger log = LoggerFactory.getLogger(PermissionGate.class);

    private final RoleProvider roleProvider;
    private final Set<String> trustedServices;

    public PermissionGate(RoleProvider roleProvider) {
        this(roleProvider, Set.of());
    }

    public PermissionGate(RoleProvider roleProvider, Set<String> trustedServices) {
        this.roleProvider = roleProvider;
        this.trustedServices = Set.copyOf(trustedServices);
    }

    public boolean canReviewDuplicates(Caller caller) {
        if (caller == null || !caller.isAuthenticated()) {
            return false;
        }
        if (caller.service()) {
            return trustedServices.contains(caller.id());
        }
        Optional<ProfileRole> role;
        try {
            role = roleProvider.findRole(caller.id());
        } catch (RuntimeException e) {
            log.warn("permission.lookup.failed callerId={} error={}", caller.id(), e.getMessage());
            return false;
        }
        return role.map(ProfileRole::canReviewDuplicates).orElse(false);
    }
}
