package com.lesson.dedup.rest.security;

import com.lesson.dedup.security.Caller;
import jakarta.ws.rs.core.SecurityContext;

import java.security.Principal;

/**
 * Recovers the {@link Caller} that {@link ApiKeyAuthFilter} attached to a request.
 */
public final class CallerContext {

    /** Role name a service identity holds in the request's security context. */
    public static final String SERVICE_ROLE = "service";

    private CallerContext() {
    }

    /**
     * The request's caller, or {@link Caller#anonymous()} when the request was not authenticated.
     */
    public static Caller from(SecurityContext securityContext) {
        if (securityContext == null) {
            return Caller.anonymous();
        }
        Principal principal = securityContext.getUserPrincipal();
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return Caller.anonymous();
        }
        return securityContext.isUserInRole(SERVICE_ROLE)
                ? Caller.service(principal.getName())
                : Caller.user(principal.getName());
    }
}
