package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.DenyReason;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fixed rule table for one resource type: for each action an ordered list of grants,
 * plus field guards for writes.
 *
 * <p>Evaluation: the first grant whose condition holds authorizes the action. If none holds
 * the decision is DENY with the most specific failure reason. Once a grant has passed,
 * every field guard runs; any violation denies the whole write.
 */
public abstract class ResourcePolicy implements Policy {

    private final ResourceType resourceType;
    private final Map<Action, List<Grant>> grants;
    private final List<FieldGuard> fieldGuards;

    protected ResourcePolicy(ResourceType resourceType, Map<Action, List<Grant>> grants, List<FieldGuard> fieldGuards) {
        this.resourceType = resourceType;
        this.grants = Collections.unmodifiableMap(new EnumMap<>(grants));
        this.fieldGuards = List.copyOf(fieldGuards);
    }

    @Override
    public String getPolicyId() {
        return resourceType.name() + "_ACCESS";
    }

    @Override
    public boolean appliesTo(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return resource.type() == resourceType;
    }

    @Override
    public PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        if (!appliesTo(subject, resource, action)) {
            return PolicyDecision.notApplicable(getPolicyId());
        }

        List<Grant> candidates = grants.get(action);
        if (candidates == null || candidates.isEmpty()) {
            return PolicyDecision.deny(getPolicyId(), DenyReason.UNSUPPORTED,
                    String.format("%s does not support %s", resourceType.displayName(), action));
        }

        Grant granted = null;
        Set<DenyReason> failures = EnumSet.noneOf(DenyReason.class);
        for (Grant grant : candidates) {
            Optional<DenyReason> failure = grant.condition().check(subject, resource);
            if (failure.isEmpty()) {
                granted = grant;
                break;
            }
            failures.add(failure.get());
        }

        if (granted == null) {
            DenyReason reason = DenyReason.mostSpecific(failures);
            return PolicyDecision.deny(getPolicyId(), reason,
                    String.format("%s on %s denied: %s", action, resourceType.displayName(), reason));
        }

        Set<String> deniedFields = new TreeSet<>();
        for (FieldGuard guard : fieldGuards) {
            deniedFields.addAll(guard.violations(subject, resource, action));
        }
        if (!deniedFields.isEmpty()) {
            return PolicyDecision.denyFields(getPolicyId(),
                    String.format("%s on %s may not set fields %s", action, resourceType.displayName(), deniedFields),
                    deniedFields);
        }

        return PolicyDecision.allow(getPolicyId(),
                String.format("%s on %s granted by %s", action, resourceType.displayName(), granted.name()));
    }
}
