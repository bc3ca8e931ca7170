package com.example.bloodlink.authz.audit;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Structured audit event for authorization decisions.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,

        // Decision
        Outcome outcome,
        String policyId,
        String reason,
        String message,
        Set<String> deniedFields,

        // Subject
        String subjectId,
        String role,

        // Resource
        String resourceType,
        String resourceId,
        String ownerId,
        String lifecycleStatus,

        // Action
        Action action
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    /**
     * Creates an audit event from a policy decision.
     */
    public static AuthzAuditEvent from(
            SubjectAttributes subject,
            ResourceAttributes resource,
            Action action,
            PolicyDecision decision) {

        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                decision.isAllowed() ? Outcome.ALLOW : Outcome.DENY,
                decision.policyId(),
                decision.reason() != null ? decision.reason().name() : null,
                decision.message(),
                decision.deniedFields(),
                subject.subjectId(),
                subject.role() != null ? subject.role().name() : null,
                resource.type() != null ? resource.type().name() : null,
                resource.id(),
                resource.ownerId(),
                resource.lifecycleStatus() != null ? resource.lifecycleStatus().name() : null,
                action
        );
    }

    /**
     * Creates an error audit event, for failures around the decision (e.g. the store could not load the record).
     */
    public static AuthzAuditEvent error(
            SubjectAttributes subject,
            ResourceAttributes.ResourceType resourceType,
            String resourceId,
            Action action,
            String errorReason) {

        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                Outcome.ERROR,
                "ERROR",
                errorReason,
                null,
                Set.of(),
                subject != null ? subject.subjectId() : null,
                subject != null && subject.role() != null ? subject.role().name() : null,
                resourceType != null ? resourceType.name() : null,
                resourceId,
                null,
                null,
                action
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "authz_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("policy_id", policyId != null ? policyId : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("message", message != null ? message : ""),
                Map.entry("denied_fields", deniedFields != null ? deniedFields : Set.of()),
                Map.entry("subject_id", subjectId != null ? subjectId : "anonymous"),
                Map.entry("role", role != null ? role : ""),
                Map.entry("resource_type", resourceType != null ? resourceType : ""),
                Map.entry("resource_id", resourceId != null ? resourceId : ""),
                Map.entry("owner_id", ownerId != null ? ownerId : ""),
                Map.entry("lifecycle_status", lifecycleStatus != null ? lifecycleStatus : ""),
                Map.entry("action", action != null ? action.name() : "")
        );
    }
}
