package com.lesson.dedup.rest.security;

import com.lesson.dedup.security.Caller;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Principal;

/**
 * Jakarta RS filter that identifies callers by API key.
 *
 * <p>Reads the key from the configured header (default {@code X-API-Key}), resolves it to a
 * {@link Caller} through {@link SecurityConfig} and installs a {@link SecurityContext} whose
 * principal is the caller id. Missing or unknown keys get {@code 401 Unauthorized}. Roles are
 * not decided here.</p>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class ApiKeyAuthFilter implements ContainerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

    /** Context property key for the authenticated caller. */
    public static final String CALLER_PROPERTY = "lesson-dedup.security.caller";

    private final SecurityConfig securityConfig;

    public ApiKeyAuthFilter(SecurityConfig securityConfig) {
        this.securityConfig = securityConfig;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!securityConfig.isEnabled()) {
            return;
        }

        String apiKey = requestContext.getHeaderString(securityConfig.getApiKeyHeader());

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("auth.rejected reason=missing_api_key path={}", requestContext.getUriInfo().getPath());
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .entity(new ErrorBody("UNAUTHORIZED",
                            "Missing API key. Provide a valid key in the '"
                                    + securityConfig.getApiKeyHeader() + "' header."))
                    .build());
            return;
        }

        Caller caller = securityConfig.getCallerForKey(apiKey);

        if (caller == null) {
            log.warn("auth.rejected reason=invalid_api_key path={}", requestContext.getUriInfo().getPath());
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .entity(new ErrorBody("UNAUTHORIZED", "Invalid API key."))
                    .build());
            return;
        }

        requestContext.setProperty(CALLER_PROPERTY, caller);

        final boolean secure = requestContext.getSecurityContext() != null
                && requestContext.getSecurityContext().isSecure();
        requestContext.setSecurityContext(new SecurityContext() {
            @Override
            public Principal getUserPrincipal() {
                return caller::id;
            }

            @Override
            public boolean isUserInRole(String roleName) {
                return caller.service() && CallerContext.SERVICE_ROLE.equals(roleName);
            }

            @Override
            public boolean isSecure() {
                return secure;
            }

            @Override
            public String getAuthenticationScheme() {
                return "API-KEY";
            }
        });

        log.debug("auth.success caller={} path={}", caller.actorId(), requestContext.getUriInfo().getPath());
    }

    /**
     * Minimal error body for auth failures.
     */
    public record ErrorBody(String error, String message) {}
}
