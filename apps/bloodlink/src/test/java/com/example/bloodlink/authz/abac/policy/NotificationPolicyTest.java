package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.DenyReason;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.bloodlink.util.SubjectAttributesTestBuilder.aDonor;
import static com.example.bloodlink.util.SubjectAttributesTestBuilder.anAdmin;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationPolicy")
class NotificationPolicyTest {

    private static final Map<String, Object> STORED = Map.of(
            "id", "n-1", "userUid", "u1", "message", "A request near you needs O-", "isRead", false);

    private NotificationPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new NotificationPolicy();
    }

    private static ResourceAttributes change(Map<String, Object> proposed) {
        return ResourceAttributes.change(ResourceType.NOTIFICATION, "n-1", "u1", null, STORED, proposed);
    }

    @Test
    @DisplayName("should let the recipient mark a notification as read")
    void shouldLetRecipientMarkRead() {
        PolicyDecision decision = policy.evaluate(aDonor("u1"),
                change(Map.of("id", "n-1", "userUid", "u1", "message", "A request near you needs O-", "isRead", true)),
                Action.UPDATE);

        assertThat(decision.isAllowed()).isTrue();
    }

    @Test
    @DisplayName("should deny the recipient rewriting the message")
    void shouldDenyRecipientRewritingMessage() {
        PolicyDecision decision = policy.evaluate(aDonor("u1"),
                change(Map.of("message", "edited", "isRead", true)), Action.UPDATE);

        assertThat(decision.reason()).isEqualTo(DenyReason.FIELD_NOT_UPDATABLE);
        assertThat(decision.deniedFields()).containsExactly("message");
    }

    @Test
    @DisplayName("should let an admin change any field but the id")
    void shouldLetAdminChangeAnyFieldButId() {
        assertThat(policy.evaluate(anAdmin(), change(Map.of("message", "edited")), Action.UPDATE).isAllowed())
                .isTrue();
        assertThat(policy.evaluate(anAdmin(), change(Map.of("id", "n-2")), Action.UPDATE).deniedFields())
                .containsExactly("id");
    }

    @Test
    @DisplayName("should deny other users reading someone's notification")
    void shouldDenyOtherUsersReading() {
        ResourceAttributes stored = ResourceAttributes.stored(ResourceType.NOTIFICATION, "n-1", "u1", null, STORED);

        assertThat(policy.evaluate(aDonor("u2"), stored, Action.READ).reason()).isEqualTo(DenyReason.NOT_OWNER);
        assertThat(policy.evaluate(aDonor("u1"), stored, Action.READ).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("should reserve create and delete for admins")
    void shouldReserveCreateAndDeleteForAdmins() {
        ResourceAttributes proposed = ResourceAttributes.proposed(ResourceType.NOTIFICATION, null, "u1", null,
                Map.of("userUid", "u1", "message", "hello"));
        ResourceAttributes stored = ResourceAttributes.stored(ResourceType.NOTIFICATION, "n-1", "u1", null, STORED);

        assertThat(policy.evaluate(aDonor("u1"), proposed, Action.CREATE).reason()).isEqualTo(DenyReason.NOT_ADMIN);
        assertThat(policy.evaluate(aDonor("u1"), stored, Action.DELETE).reason()).isEqualTo(DenyReason.NOT_ADMIN);
        assertThat(policy.evaluate(anAdmin(), proposed, Action.CREATE).isAllowed()).isTrue();
        assertThat(policy.evaluate(anAdmin(), stored, Action.DELETE).isAllowed()).isTrue();
    }
}
