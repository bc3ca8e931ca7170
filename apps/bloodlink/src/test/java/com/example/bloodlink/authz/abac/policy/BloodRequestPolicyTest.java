package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.DenyReason;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.store.model.RequestStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static com.example.bloodlink.util.SubjectAttributesTestBuilder.aDonor;
import static com.example.bloodlink.util.SubjectAttributesTestBuilder.aRecipient;
import static com.example.bloodlink.util.SubjectAttributesTestBuilder.anAdmin;
import static com.example.bloodlink.util.SubjectAttributesTestBuilder.anonymous;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BloodRequestPolicy")
class BloodRequestPolicyTest {

    private static final String OWNER = "donor-d";

    private BloodRequestPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new BloodRequestPolicy();
    }

    private static ResourceAttributes storedRequest(RequestStatus status) {
        return ResourceAttributes.stored(ResourceType.BLOOD_REQUEST, "req-1", OWNER, status,
                Map.of("id", "req-1", "requesterUid", OWNER, "unitsRequired", 2, "status", status.name()));
    }

    private static ResourceAttributes requestChange(RequestStatus status, Map<String, Object> proposed) {
        return ResourceAttributes.change(ResourceType.BLOOD_REQUEST, "req-1", OWNER, status,
                Map.of("id", "req-1", "requesterUid", OWNER, "unitsRequired", 2, "status", status.name()),
                proposed);
    }

    private static ResourceAttributes newRequest(String requesterUid) {
        return ResourceAttributes.proposed(ResourceType.BLOOD_REQUEST, null, requesterUid,
                RequestStatus.PENDING_VERIFICATION,
                Map.of("requesterUid", requesterUid, "unitsRequired", 2, "status", "PENDING_VERIFICATION"));
    }

    @Nested
    @DisplayName("CREATE")
    class Create {

        @Test
        @DisplayName("should allow a donor to create a request for themselves")
        void shouldAllowOwnRequest() {
            PolicyDecision decision = policy.evaluate(aDonor(OWNER), newRequest(OWNER), Action.CREATE);

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.message()).contains("granted by own-request");
        }

        @Test
        @DisplayName("should deny creating a request on behalf of someone else")
        void shouldDenyRequestForSomeoneElse() {
            PolicyDecision decision = policy.evaluate(aDonor("other"), newRequest(OWNER), Action.CREATE);

            assertThat(decision.reason()).isEqualTo(DenyReason.NOT_OWNER);
        }

        @Test
        @DisplayName("should deny anonymous callers even when no owner is proposed")
        void shouldDenyAnonymousCreate() {
            ResourceAttributes ownerless = ResourceAttributes.proposed(ResourceType.BLOOD_REQUEST, null, null,
                    RequestStatus.PENDING_VERIFICATION, Map.of("unitsRequired", 1));

            PolicyDecision decision = policy.evaluate(anonymous(), ownerless, Action.CREATE);

            assertThat(decision.reason()).isEqualTo(DenyReason.NOT_AUTHENTICATED);
        }

        @Test
        @DisplayName("should allow an admin to file a request for a user")
        void shouldAllowAdmin() {
            assertThat(policy.evaluate(anAdmin(), newRequest(OWNER), Action.CREATE).isAllowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("READ")
    class Read {

        @Test
        @DisplayName("should hide a pending verification request from other non-admins until it becomes active")
        void shouldHidePendingRequestUntilActive() {
            PolicyDecision pending = policy.evaluate(aRecipient("r1"),
                    storedRequest(RequestStatus.PENDING_VERIFICATION), Action.READ);
            PolicyDecision active = policy.evaluate(aRecipient("r1"),
                    storedRequest(RequestStatus.ACTIVE), Action.READ);

            assertThat(pending.isDenied()).isTrue();
            assertThat(pending.reason()).isEqualTo(DenyReason.INVALID_LIFECYCLE_STATE);
            assertThat(active.isAllowed()).isTrue();
            assertThat(active.message()).contains("granted by publicly-visible");
        }

        @ParameterizedTest
        @EnumSource(value = RequestStatus.class, names = {"ACTIVE", "PARTIALLY_FULFILLED", "FULFILLED"})
        @DisplayName("should show publicly visible requests to any signed-in user")
        void shouldShowPubliclyVisibleRequests(RequestStatus status) {
            assertThat(policy.evaluate(aDonor("other"), storedRequest(status), Action.READ).isAllowed()).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = RequestStatus.class, names = {"PENDING_VERIFICATION", "PENDING", "CANCELLED", "EXPIRED"})
        @DisplayName("should hide non-public requests from other users")
        void shouldHideNonPublicRequests(RequestStatus status) {
            PolicyDecision decision = policy.evaluate(aDonor("other"), storedRequest(status), Action.READ);

            assertThat(decision.reason()).isEqualTo(DenyReason.INVALID_LIFECYCLE_STATE);
        }

        @ParameterizedTest
        @EnumSource(RequestStatus.class)
        @DisplayName("should always let the owner and admins read")
        void shouldAlwaysLetOwnerAndAdminRead(RequestStatus status) {
            assertThat(policy.evaluate(aDonor(OWNER), storedRequest(status), Action.READ).isAllowed()).isTrue();
            assertThat(policy.evaluate(anAdmin(), storedRequest(status), Action.READ).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("should deny anonymous callers even for active requests")
        void shouldDenyAnonymousRead() {
            PolicyDecision decision = policy.evaluate(anonymous(), storedRequest(RequestStatus.ACTIVE), Action.READ);

            assertThat(decision.reason()).isEqualTo(DenyReason.NOT_AUTHENTICATED);
        }
    }

    @Nested
    @DisplayName("UPDATE")
    class Update {

        @ParameterizedTest
        @EnumSource(value = RequestStatus.class, names = {"PENDING_VERIFICATION", "PENDING", "ACTIVE"})
        @DisplayName("should allow the owner while the request is editable")
        void shouldAllowOwnerWhileEditable(RequestStatus status) {
            ResourceAttributes change = requestChange(status, Map.of("unitsRequired", 3));

            PolicyDecision decision = policy.evaluate(aDonor(OWNER), change, Action.UPDATE);

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.message()).contains("granted by self-while-editable");
        }

        @ParameterizedTest
        @EnumSource(value = RequestStatus.class, names = {"FULFILLED", "CANCELLED", "EXPIRED", "PARTIALLY_FULFILLED"})
        @DisplayName("should deny the owner once the request is finalized, but allow an admin")
        void shouldDenyOwnerOnceFinalized(RequestStatus status) {
            ResourceAttributes change = requestChange(status, Map.of("unitsRequired", 3));

            PolicyDecision owner = policy.evaluate(aDonor(OWNER), change, Action.UPDATE);
            PolicyDecision admin = policy.evaluate(anAdmin(), change, Action.UPDATE);

            assertThat(owner.isDenied()).isTrue();
            assertThat(owner.reason()).isEqualTo(DenyReason.INVALID_LIFECYCLE_STATE);
            assertThat(admin.isAllowed()).isTrue();
        }

        @Test
        @DisplayName("should deny a non-owner with NOT_OWNER")
        void shouldDenyNonOwner() {
            ResourceAttributes change = requestChange(RequestStatus.ACTIVE, Map.of("unitsRequired", 3));

            PolicyDecision decision = policy.evaluate(aDonor("other"), change, Action.UPDATE);

            assertThat(decision.reason()).isEqualTo(DenyReason.NOT_OWNER);
        }

        @Test
        @DisplayName("should deny the owner handing the request to another user")
        void shouldDenyOwnerReassigningRequester() {
            ResourceAttributes change = requestChange(RequestStatus.PENDING,
                    Map.of("requesterUid", "someone-else"));

            PolicyDecision decision = policy.evaluate(aDonor(OWNER), change, Action.UPDATE);

            assertThat(decision.reason()).isEqualTo(DenyReason.FIELD_NOT_UPDATABLE);
            assertThat(decision.deniedFields()).containsExactly("requesterUid");
        }

        @Test
        @DisplayName("should report every denied field at once")
        void shouldReportEveryDeniedField() {
            ResourceAttributes change = requestChange(RequestStatus.PENDING,
                    Map.of("id", "req-2", "requesterUid", "someone-else"));

            PolicyDecision decision = policy.evaluate(aDonor(OWNER), change, Action.UPDATE);

            assertThat(decision.deniedFields()).containsExactlyInAnyOrder("id", "requesterUid");
        }
    }

    @Nested
    @DisplayName("DELETE")
    class Delete {

        @Test
        @DisplayName("should allow the owner in any state")
        void shouldAllowOwner() {
            assertThat(policy.evaluate(aDonor(OWNER), storedRequest(RequestStatus.FULFILLED), Action.DELETE)
                    .isAllowed()).isTrue();
        }

        @Test
        @DisplayName("should deny other users")
        void shouldDenyOtherUsers() {
            PolicyDecision decision = policy.evaluate(aRecipient("other"),
                    storedRequest(RequestStatus.ACTIVE), Action.DELETE);

            assertThat(decision.reason()).isEqualTo(DenyReason.NOT_OWNER);
        }
    }
}
