package com.example.bloodlink.common.exception;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.DenyReason;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import lombok.Getter;

import java.util.Set;

// A write or read rejected by the access policy. Writes are never partially applied.
@Getter
public class PolicyDeniedException extends RuntimeException {

    private final PolicyDecision decision;
    private final ResourceType resourceType;
    private final String resourceId;
    private final Action action;

    public PolicyDeniedException(PolicyDecision decision, ResourceType resourceType, String resourceId, Action action) {
        super(String.format("%s on %s %s denied: %s", action, resourceType.displayName(),
                resourceId != null ? resourceId : "(new)", decision.reason()));
        this.decision = decision;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.action = action;
    }

    public DenyReason getReason() {
        return decision.reason();
    }

    /**
     * Fields the caller may not set, for client-side correction. Empty unless the reason is FIELD_NOT_UPDATABLE.
     */
    public Set<String> getDeniedFields() {
        return decision.deniedFields();
    }
}
