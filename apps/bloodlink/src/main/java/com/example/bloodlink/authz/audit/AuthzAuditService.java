package com.example.bloodlink.authz.audit;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;
import com.example.bloodlink.common.util.StringSanitizer;
import com.example.bloodlink.config.properties.AuthzProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Service for publishing authorization audit events in structured JSON format.
 */
@Service
@ConditionalOnProperty(name = "app.authz.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final ObjectMapper objectMapper;
    private final boolean logAllowed;

    public AuthzAuditService(ObjectMapper objectMapper, AuthzProperties properties) {
        this.objectMapper = objectMapper;
        this.logAllowed = properties.audit().logAllowed();
    }

    public void logDecision(
            @NonNull SubjectAttributes subject,
            @NonNull ResourceAttributes resource,
            @NonNull Action action,
            @NonNull PolicyDecision decision) {

        if (decision.isAllowed() && !logAllowed) {
            return;
        }
        logEvent(AuthzAuditEvent.from(subject, resource, action, decision));
    }

    public void logError(
            @Nullable SubjectAttributes subject,
            @NonNull ResourceAttributes.ResourceType resourceType,
            @Nullable String resourceId,
            @NonNull Action action,
            @NonNull String errorReason) {

        logEvent(AuthzAuditEvent.error(subject, resourceType, resourceId, action, errorReason));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(@Nullable AuthzAuditEvent.Outcome outcome, String json) {
        if (outcome == null) {
            AUDIT_LOG.warn(json);
            return;
        }

        switch (outcome) {
            case ALLOW -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - subject={}, resource={}/{}, action={}, policy={}, reason={}",
                event.outcome(),
                StringSanitizer.forLog(event.subjectId()),
                StringSanitizer.forLog(event.resourceType()),
                StringSanitizer.forLog(event.resourceId()),
                event.action(),
                StringSanitizer.forLog(event.policyId()),
                StringSanitizer.forLog(event.reason()));
    }
}
