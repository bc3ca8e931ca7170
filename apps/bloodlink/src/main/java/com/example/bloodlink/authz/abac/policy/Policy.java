package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;

/**
 * Access rules for one kind of resource.
 *
 * <p>A policy answers NOT_APPLICABLE for any resource kind it does not cover, so the engine
 * moves on to the next one. For its own kind it must answer ALLOW or DENY, never throw.
 */
public interface Policy {

    /**
     * Identifier written to audit events and decision messages, e.g. {@code BLOOD_REQUEST_ACCESS}.
     */
    String getPolicyId();

    /**
     * Human-readable description of the policy.
     */
    String getDescription();

    /**
     * Evaluation order; higher runs first. Rule tables use 0, overrides (maintenance, lockdown) go above.
     */
    default int getPriority() {
        return 0;
    }

    /**
     * Decide one action on one resource.
     *
     * @param subject  the caller, never null (anonymous callers have no id)
     * @param resource stored and proposed state of the record
     * @param action   the action requested
     * @return ALLOW, DENY with a reason, or NOT_APPLICABLE for a resource kind this policy does not cover
     */
    PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action);

    /**
     * Cheap pre-filter run by the engine before {@link #evaluate}; rule tables match on the resource kind.
     */
    default boolean appliesTo(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return true;
    }
}
