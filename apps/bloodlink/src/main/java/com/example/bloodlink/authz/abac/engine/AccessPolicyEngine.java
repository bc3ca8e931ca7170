package com.example.bloodlink.authz.abac.engine;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.DenyReason;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;
import com.example.bloodlink.authz.abac.policy.Policy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * ABAC Policy Engine - evaluates policies to make access control decisions.
 *
 * <p>Policy combining algorithm: First Applicable (deny-biased)
 * - Policies are evaluated in priority order
 * - First ALLOW or DENY decision wins
 * - If no policy matches, default is DENY
 *
 * <p>The engine holds no mutable state and is safe to call from any thread.
 * It never throws: malformed input and failures inside a policy become DENY(UNSUPPORTED).
 */
@Slf4j
@Component
public class AccessPolicyEngine {

    static final String ENGINE_POLICY_ID = "ENGINE";

    private final List<Policy> policies;

    public AccessPolicyEngine(List<Policy> policies) {
        // Sort injected policies by priority (highest first)
        this.policies = policies.stream()
                .sorted(Comparator.comparingInt(Policy::getPriority).reversed())
                .toList();

        log.info("Access policy engine initialized with {} policies", this.policies.size());
        this.policies.forEach(p -> log.debug("  - {} (priority={}): {}",
                p.getPolicyId(), p.getPriority(), p.getDescription()));
    }

    /**
     * Evaluate all applicable policies and return the access decision.
     *
     * @param subject  The caller; null is treated as anonymous
     * @param resource The resource being accessed
     * @param action   The action being performed
     * @return PolicyDecision with ALLOW or DENY
     */
    public PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        SubjectAttributes caller = subject != null ? subject : SubjectAttributes.anonymous();

        if (resource == null || resource.type() == null || action == null) {
            log.warn("Access DENIED (malformed request): subject={}, resource={}, action={}",
                    caller.displayId(), resource != null ? resource.type() : null, action);
            return PolicyDecision.deny(ENGINE_POLICY_ID, DenyReason.UNSUPPORTED,
                    "Resource type and action are required");
        }

        log.debug("Evaluating access: subject={}, resource={}/{}, action={}",
                caller.displayId(), resource.type(), resource.id(), action);

        try {
            for (Policy policy : policies) {
                if (!policy.appliesTo(caller, resource, action)) {
                    continue;
                }

                PolicyDecision decision = policy.evaluate(caller, resource, action);

                if (decision.isAllowed()) {
                    log.info("Access ALLOWED by policy {}: {} (subject={}, resource={}, action={})",
                            policy.getPolicyId(), decision.message(),
                            caller.displayId(), resource.id(), action);
                    return decision;
                }

                if (decision.isDenied()) {
                    log.warn("Access DENIED by policy {}: {} (subject={}, resource={}, action={})",
                            policy.getPolicyId(), decision.message(),
                            caller.displayId(), resource.id(), action);
                    return decision;
                }

                // NOT_APPLICABLE - continue to next policy
            }
        } catch (RuntimeException e) {
            log.error("Access DENIED (policy evaluation failed): subject={}, resource={}/{}, action={}",
                    caller.displayId(), resource.type(), resource.id(), action, e);
            return PolicyDecision.deny(ENGINE_POLICY_ID, DenyReason.UNSUPPORTED,
                    "Policy evaluation failed");
        }

        log.warn("Access DENIED (no applicable policy): subject={}, resource={}/{}, action={}",
                caller.displayId(), resource.type(), resource.id(), action);
        return PolicyDecision.deny(ENGINE_POLICY_ID, DenyReason.UNSUPPORTED,
                "No policy covers " + resource.type().displayName());
    }
}
