package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.DenyReason;
import com.example.bloodlink.authz.abac.model.LifecycleStatus;

import java.util.Optional;
import java.util.Set;

/**
 * The conditions shared by all resource policies.
 */
public final class Conditions {

    private static final Optional<DenyReason> HOLDS = Optional.empty();

    private Conditions() {
    }

    /**
     * Caller is the resource owner. On create the owner comes from the proposed record.
     */
    public static Condition self() {
        return (subject, resource) -> {
            if (!subject.isAuthenticated()) {
                return Optional.of(DenyReason.NOT_AUTHENTICATED);
            }
            return subject.isSubject(resource.ownerId()) ? HOLDS : Optional.of(DenyReason.NOT_OWNER);
        };
    }

    public static Condition admin() {
        return (subject, resource) -> {
            if (!subject.isAuthenticated()) {
                return Optional.of(DenyReason.NOT_AUTHENTICATED);
            }
            return subject.isAdmin() ? HOLDS : Optional.of(DenyReason.NOT_ADMIN);
        };
    }

    public static Condition authenticated() {
        return (subject, resource) -> subject.isAuthenticated()
                ? HOLDS
                : Optional.of(DenyReason.NOT_AUTHENTICATED);
    }

    /**
     * Public access: no identity required.
     */
    public static Condition anyone() {
        return (subject, resource) -> HOLDS;
    }

    /**
     * Resource is currently in one of the given states. A resource without status never matches.
     */
    public static Condition statusIn(Set<? extends LifecycleStatus> states) {
        Set<LifecycleStatus> allowed = Set.copyOf(states);
        return (subject, resource) -> resource.lifecycleStatus() != null && allowed.contains(resource.lifecycleStatus())
                ? HOLDS
                : Optional.of(DenyReason.INVALID_LIFECYCLE_STATE);
    }
}
