package com.lesson.dedup.security;

/**
 * Identity on whose behalf an operation runs.
 *
 * @param id      user id, or the name of a service identity; null for an anonymous caller
 * @param service whether the identity is a trusted service rather than a user
 */
public record Caller(String id, boolean service) {

    private static final Caller ANONYMOUS = new Caller(null, false);

    public static Caller user(String userId) {
        return new Caller(userId, false);
    }

    public static Caller service(String name) {
        return new Caller(name, true);
    }

    public static Caller anonymous() {
        return ANONYMOUS;
    }

    public boolean isAuthenticated() {
        return id != null && !id.isBlank();
    }

    /**
     * Identifier recorded in archive, decision and dismissal rows.
     */
    public String actorId() {
        if (!isAuthenticated()) {
            return "anonymous";
        }
        return service ? "service:" + id : id;
    }
}
