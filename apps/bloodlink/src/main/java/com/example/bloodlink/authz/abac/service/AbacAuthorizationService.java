package com.example.bloodlink.authz.abac.service;

import com.example.bloodlink.authz.abac.engine.AccessPolicyEngine;
import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;
import com.example.bloodlink.authz.audit.AuthzAuditService;
import com.example.bloodlink.common.exception.PolicyDeniedException;
import com.example.bloodlink.observability.metrics.PolicyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point for the record store: evaluates the access policy, records audit and metrics,
 * and turns denials into errors.
 */
@Slf4j
@Service
public class AbacAuthorizationService {

    private final AccessPolicyEngine policyEngine;

    @Nullable
    private final AuthzAuditService auditService;

    @Nullable
    private final PolicyMetrics policyMetrics;

    public AbacAuthorizationService(
            AccessPolicyEngine policyEngine,
            @Nullable AuthzAuditService auditService,
            @Nullable PolicyMetrics policyMetrics) {
        this.policyEngine = policyEngine;
        this.auditService = auditService;
        this.policyMetrics = policyMetrics;
    }

    /**
     * Evaluate the policy and record the decision.
     *
     * @param subject  Subject attributes
     * @param resource Resource attributes
     * @param action   Action being performed
     * @return the policy decision
     */
    public PolicyDecision decide(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        SubjectAttributes caller = subject != null ? subject : SubjectAttributes.anonymous();
        PolicyDecision decision = policyEngine.evaluate(caller, resource, action);

        if (auditService != null && resource != null && action != null) {
            auditService.logDecision(caller, resource, action, decision);
        }
        if (policyMetrics != null) {
            policyMetrics.recordDecision(resource != null ? resource.type() : null, action, decision);
        }
        return decision;
    }

    /**
     * Check if access is allowed for the given request context.
     *
     * @return Mono emitting the policy decision
     */
    public Mono<PolicyDecision> authorize(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return Mono.fromSupplier(() -> decide(subject, resource, action));
    }

    /**
     * Same as {@link #authorize} but fails with {@link PolicyDeniedException} unless the decision is ALLOW.
     */
    public Mono<PolicyDecision> enforce(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return authorize(subject, resource, action)
                .flatMap(decision -> decision.isAllowed()
                        ? Mono.just(decision)
                        : Mono.error(new PolicyDeniedException(decision, resource.type(), resource.id(), action)));
    }

    /**
     * Record a failure that prevented a decision from being made.
     */
    public void recordError(SubjectAttributes subject, ResourceAttributes.ResourceType resourceType,
                            String resourceId, Action action, Throwable error) {
        log.error("Authorization flow failed: type={}, id={}, action={}: {}",
                resourceType, resourceId, action, error.getMessage());
        if (auditService != null) {
            auditService.logError(subject, resourceType, resourceId, action, error.getClass().getSimpleName());
        }
    }
}
