package com.lesson.dedup.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProfileRole Tests")
class ProfileRoleTest {

    @Test
    void parsesCaseInsensitively() {
        assertEquals(ProfileRole.SUPER_ADMIN, ProfileRole.fromString(" super_admin "));
        assertEquals(ProfileRole.REVIEWER, ProfileRole.fromString("Reviewer"));
    }

    @Test
    void rejectsUnknownRoles() {
        assertThrows(IllegalArgumentException.class, () -> ProfileRole.fromString("janitor"));
        assertThrows(IllegalArgumentException.class, () -> ProfileRole.fromString(" "));
    }

    @Test
    @DisplayName("Actor ids distinguish services and anonymous callers")
    void actorIds() {
        assertEquals("u1", Caller.user("u1").actorId());
        assertEquals("service:nightly", Caller.service("nightly").actorId());
        assertEquals("anonymous", Caller.anonymous().actorId());
    }
}
