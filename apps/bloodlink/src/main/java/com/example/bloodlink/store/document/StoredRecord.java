package com.example.bloodlink.store.document;

import com.example.bloodlink.authz.abac.model.LifecycleStatus;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.common.exception.InvalidRecordException;

/**
 * What the policy-enforced store needs to know about a persisted record.
 *
 * <p>Accessors here are not bean getters, so they stay out of the
 * field map the policy compares.
 */
public interface StoredRecord {

    ResourceType resourceType();

    /**
     * Immutable identity key; null before the first save for generated ids.
     */
    String recordId();

    void assignRecordId(String id);

    /**
     * Optimistic-lock version; null for records not saved yet.
     */
    Long getVersion();

    void setVersion(Long version);

    /**
     * The owning user's uid, or null for records nobody owns.
     */
    default String ownerRef() {
        return null;
    }

    default LifecycleStatus lifecycleStatus() {
        return null;
    }

    /**
     * Check record-level constraints before a write.
     *
     * @throws InvalidRecordException if a constraint does not hold
     */
    default void checkConstraints() {
    }
}
