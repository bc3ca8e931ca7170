package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;

import java.util.Set;
import java.util.TreeSet;

/**
 * Field-level invariant checked after an action-level grant has passed.
 * Any violation turns the decision into a FIELD_NOT_UPDATABLE denial.
 */
@FunctionalInterface
public interface FieldGuard {

    /**
     * @return names of the fields this write may not set; empty if the write is acceptable
     */
    Set<String> violations(SubjectAttributes subject, ResourceAttributes resource, Action action);

    /**
     * Fields that never change once a record exists, whoever asks.
     */
    static FieldGuard immutable(String... fields) {
        Set<String> guarded = Set.of(fields);
        return (subject, resource, action) -> {
            if (action != Action.UPDATE) {
                return Set.of();
            }
            return intersect(resource.changedFields(), guarded);
        };
    }

    /**
     * Fields only an admin may change on update.
     */
    static FieldGuard adminOnly(String... fields) {
        Set<String> guarded = Set.of(fields);
        return (subject, resource, action) -> {
            if (action != Action.UPDATE || subject.isAdmin()) {
                return Set.of();
            }
            return intersect(resource.changedFields(), guarded);
        };
    }

    /**
     * On update a non-admin may change the listed fields and nothing else.
     */
    static FieldGuard nonAdminMayOnlyChange(String... fields) {
        Set<String> writable = Set.of(fields);
        return (subject, resource, action) -> {
            if (action != Action.UPDATE || subject.isAdmin()) {
                return Set.of();
            }
            Set<String> denied = new TreeSet<>(resource.changedFields());
            denied.removeAll(writable);
            return denied;
        };
    }

    /**
     * On create and update a non-admin may only propose one of the given values (or none) for a field.
     * Values are compared by their string form, as stored records expose enums by name.
     */
    static FieldGuard nonAdminValues(String field, Set<String> allowedValues) {
        Set<String> allowed = Set.copyOf(allowedValues);
        return (subject, resource, action) -> {
            if (subject.isAdmin() || (action != Action.CREATE && action != Action.UPDATE)) {
                return Set.of();
            }
            if (!resource.changedFields().contains(field)) {
                return Set.of();
            }
            Object value = resource.proposedValue(field);
            if (value == null || allowed.contains(String.valueOf(value))) {
                return Set.of();
            }
            return Set.of(field);
        };
    }

    private static Set<String> intersect(Set<String> changed, Set<String> guarded) {
        Set<String> hits = new TreeSet<>(changed);
        hits.retainAll(guarded);
        return hits;
    }
}
