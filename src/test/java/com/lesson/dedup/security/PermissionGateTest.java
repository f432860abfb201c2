package com.lesson.dedup.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("PermissionGate Tests")
class PermissionGateTest {

    private InMemoryRoleProvider roles;
    private PermissionGate gate;

    @BeforeEach
    void setUp() {
        roles = new InMemoryRoleProvider();
        gate = new PermissionGate(roles, Set.of("nightly-dedup"));
    }

    @Nested
    @DisplayName("User callers")
    class Users {

        @ParameterizedTest
        @EnumSource(value = ProfileRole.class, names = {"REVIEWER", "ADMIN", "SUPER_ADMIN"})
        @DisplayName("Reviewer and above are allowed")
        void privilegedRoles(ProfileRole role) {
            roles.assign("u1", role);
            assertTrue(gate.canReviewDuplicates(Caller.user("u1")));
        }

        @Test
        @DisplayName("Teachers are denied")
        void teacherDenied() {
            roles.assign("u1", ProfileRole.TEACHER);
            assertFalse(gate.canReviewDuplicates(Caller.user("u1")));
        }

        @Test
        @DisplayName("Users without a profile are denied")
        void noProfile() {
            assertFalse(gate.canReviewDuplicates(Caller.user("ghost")));
        }

        @Test
        @DisplayName("A revoked role takes effect on the next check")
        void freshLookup() {
            roles.assign("u1", ProfileRole.ADMIN);
            assertTrue(gate.canReviewDuplicates(Caller.user("u1")));

            roles.assign("u1", ProfileRole.TEACHER);
            assertFalse(gate.canReviewDuplicates(Caller.user("u1")));

            roles.revoke("u1");
            assertFalse(gate.canReviewDuplicates(Caller.user("u1")));
        }

        @Test
        @DisplayName("A failing role lookup denies")
        void failsClosed() {
            RoleProvider broken = mock(RoleProvider.class);
            when(broken.findRole(anyString())).thenThrow(new IllegalStateException("graph unavailable"));

            assertFalse(new PermissionGate(broken).canReviewDuplicates(Caller.user("u1")));
        }
    }

    @Nested
    @DisplayName("Service and anonymous callers")
    class NonUsers {

        @Test
        void trustedServiceAllowed() {
            assertTrue(gate.canReviewDuplicates(Caller.service("nightly-dedup")));
        }

        @Test
        @DisplayName("An unknown service is denied even if a user with that id is privileged")
        void untrustedServiceDenied() {
            roles.assign("importer", ProfileRole.ADMIN);
            assertFalse(gate.canReviewDuplicates(Caller.service("importer")));
        }

        @Test
        void anonymousDenied() {
            assertFalse(gate.canReviewDuplicates(Caller.anonymous()));
            assertFalse(gate.canReviewDuplicates(null));
        }
    }
}
