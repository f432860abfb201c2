package com.lesson.dedup.security;

import java.util.Optional;

/**
 * Source of user profile roles. Implementations must read the current role on every call.
 */
public interface RoleProvider {

    /**
     * @return the user's role, or empty when the user has no profile
     */
    Optional<ProfileRole> findRole(String userId);
}
