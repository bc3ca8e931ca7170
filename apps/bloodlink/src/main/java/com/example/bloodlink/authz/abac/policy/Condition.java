package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.DenyReason;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;

import java.util.Optional;

/**
 * A single test on subject and resource. Reports why it failed instead of a bare boolean,
 * so a denial can name its cause.
 */
@FunctionalInterface
public interface Condition {

    /**
     * @return empty when the condition holds, otherwise the reason it does not
     */
    Optional<DenyReason> check(SubjectAttributes subject, ResourceAttributes resource);

    /**
     * Both conditions must hold; the first failure is reported.
     */
    default Condition and(Condition other) {
        return (subject, resource) -> {
            Optional<DenyReason> failure = check(subject, resource);
            return failure.isPresent() ? failure : other.check(subject, resource);
        };
    }
}
