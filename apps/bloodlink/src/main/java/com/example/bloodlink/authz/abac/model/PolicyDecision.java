package com.example.bloodlink.authz.abac.model;

import java.util.Set;

/**
 * ABAC Policy Decision - the result of evaluating a policy.
 *
 * <p>{@code reason} is null for ALLOW and NOT_APPLICABLE decisions. {@code deniedFields}
 * is only populated when a field guard rejected an otherwise permitted write.
 */
public record PolicyDecision(
        Decision decision,
        DenyReason reason,
        String policyId,
        String message,
        Set<String> deniedFields
) {
    public enum Decision {
        ALLOW,
        DENY,
        NOT_APPLICABLE  // Policy doesn't cover this resource type
    }

    public PolicyDecision {
        deniedFields = deniedFields == null ? Set.of() : Set.copyOf(deniedFields);
    }

    /**
     * Create an ALLOW decision.
     */
    public static PolicyDecision allow(String policyId, String message) {
        return new PolicyDecision(Decision.ALLOW, null, policyId, message, Set.of());
    }

    /**
     * Create a DENY decision.
     */
    public static PolicyDecision deny(String policyId, DenyReason reason, String message) {
        return new PolicyDecision(Decision.DENY, reason, policyId, message, Set.of());
    }

    /**
     * Create a DENY decision for fields the subject may not change.
     */
    public static PolicyDecision denyFields(String policyId, String message, Set<String> deniedFields) {
        return new PolicyDecision(Decision.DENY, DenyReason.FIELD_NOT_UPDATABLE, policyId, message, deniedFields);
    }

    /**
     * Create a NOT_APPLICABLE decision.
     */
    public static PolicyDecision notApplicable(String policyId) {
        return new PolicyDecision(Decision.NOT_APPLICABLE, null, policyId, "Policy not applicable", Set.of());
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public boolean isDenied() {
        return decision == Decision.DENY;
    }

    public boolean isNotApplicable() {
        return decision == Decision.NOT_APPLICABLE;
    }
}
