package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static com.example.bloodlink.util.SubjectAttributesTestBuilder.aDonor;
import static com.example.bloodlink.util.SubjectAttributesTestBuilder.anAdmin;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FieldGuard")
class FieldGuardTest {

    private static final Map<String, Object> CURRENT = Map.of("uid", "u1", "role", "DONOR", "phone", "555-0100");

    private static ResourceAttributes change(Map<String, Object> proposed) {
        return ResourceAttributes.change(ResourceType.USER, "u1", "u1", null, CURRENT, proposed);
    }

    @Nested
    @DisplayName("immutable")
    class Immutable {

        private final FieldGuard guard = FieldGuard.immutable("uid");

        @Test
        @DisplayName("should flag a changed identity key for every caller")
        void shouldFlagChangedIdentityKey() {
            assertThat(guard.violations(anAdmin(), change(Map.of("uid", "u2")), Action.UPDATE))
                    .containsExactly("uid");
        }

        @Test
        @DisplayName("should accept an identical identity key")
        void shouldAcceptIdenticalIdentityKey() {
            assertThat(guard.violations(aDonor("u1"), change(Map.of("uid", "u1")), Action.UPDATE)).isEmpty();
        }

        @Test
        @DisplayName("should not apply on create")
        void shouldNotApplyOnCreate() {
            ResourceAttributes proposed = ResourceAttributes.proposed(ResourceType.USER, "u1", "u1", null,
                    Map.of("uid", "u1"));

            assertThat(guard.violations(aDonor("u1"), proposed, Action.CREATE)).isEmpty();
        }
    }

    @Nested
    @DisplayName("adminOnly")
    class AdminOnly {

        private final FieldGuard guard = FieldGuard.adminOnly("role");

        @Test
        @DisplayName("should flag a non-admin change and let an admin through")
        void shouldFlagNonAdminChange() {
            ResourceAttributes change = change(Map.of("role", "ADMIN"));

            assertThat(guard.violations(aDonor("u1"), change, Action.UPDATE)).containsExactly("role");
            assertThat(guard.violations(anAdmin(), change, Action.UPDATE)).isEmpty();
        }
    }

    @Nested
    @DisplayName("nonAdminMayOnlyChange")
    class NonAdminMayOnlyChange {

        private final FieldGuard guard = FieldGuard.nonAdminMayOnlyChange("phone");

        @Test
        @DisplayName("should flag every changed field outside the writable set, sorted")
        void shouldFlagFieldsOutsideWritableSet() {
            ResourceAttributes change = change(Map.of("uid", "u2", "role", "ADMIN", "phone", "555-0199"));

            assertThat(guard.violations(aDonor("u1"), change, Action.UPDATE)).containsExactly("role", "uid");
        }
    }

    @Nested
    @DisplayName("nonAdminValues")
    class NonAdminValues {

        private final FieldGuard guard = FieldGuard.nonAdminValues("role", Set.of("DONOR", "RECIPIENT"));

        @Test
        @DisplayName("should flag a value outside the allowed set on create")
        void shouldFlagValueOutsideAllowedSet() {
            ResourceAttributes proposed = ResourceAttributes.proposed(ResourceType.USER, "u1", "u1", null,
                    Map.of("uid", "u1", "role", "ADMIN"));

            assertThat(guard.violations(aDonor("u1"), proposed, Action.CREATE)).containsExactly("role");
            assertThat(guard.violations(anAdmin(), proposed, Action.CREATE)).isEmpty();
        }

        @Test
        @DisplayName("should accept an allowed value")
        void shouldAcceptAllowedValue() {
            ResourceAttributes proposed = ResourceAttributes.proposed(ResourceType.USER, "u1", "u1", null,
                    Map.of("uid", "u1", "role", "RECIPIENT"));

            assertThat(guard.violations(aDonor("u1"), proposed, Action.CREATE)).isEmpty();
        }

        @Test
        @DisplayName("should ignore reads and deletes")
        void shouldIgnoreReadsAndDeletes() {
            ResourceAttributes change = change(Map.of("role", "ADMIN"));

            assertThat(guard.violations(aDonor("u1"), change, Action.READ)).isEmpty();
            assertThat(guard.violations(aDonor("u1"), change, Action.DELETE)).isEmpty();
        }
    }
}
