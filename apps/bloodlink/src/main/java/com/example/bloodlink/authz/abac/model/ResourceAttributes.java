package com.example.bloodlink.authz.abac.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * ABAC Resource Attributes - the record being accessed.
 *
 * <p>{@code currentFields} holds the stored values and is empty on create.
 * {@code proposedFields} holds the values of the incoming write and is empty on read and delete.
 * {@code ownerId} and {@code lifecycleStatus} come from the stored record, except on create
 * where they come from the proposed one.
 */
public record ResourceAttributes(
        ResourceType type,
        String id,
        String ownerId,
        LifecycleStatus lifecycleStatus,
        Map<String, Object> currentFields,
        Map<String, Object> proposedFields
) {
    /**
     * Resource types in the system.
     */
    public enum ResourceType {
        USER("User"),
        BLOOD_BANK("BloodBank"),
        CAMPAIGN("Campaign"),
        BLOOD_REQUEST("BloodRequest"),
        DONATION("Donation"),
        NOTIFICATION("Notification");

        private final String displayName;

        ResourceType(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    public ResourceAttributes {
        // Map.copyOf rejects null values, and unset record fields are null
        currentFields = currentFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(currentFields));
        proposedFields = proposedFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(proposedFields));
    }

    /**
     * Create resource attributes for a stored record (read or delete).
     */
    public static ResourceAttributes stored(
            ResourceType type,
            String id,
            String ownerId,
            LifecycleStatus lifecycleStatus,
            Map<String, Object> fields) {
        return new ResourceAttributes(type, id, ownerId, lifecycleStatus, fields, Map.of());
    }

    /**
     * Create resource attributes for a record that does not exist yet.
     *
     * @param ownerId the owner named by the incoming write
     */
    public static ResourceAttributes proposed(
            ResourceType type,
            String id,
            String ownerId,
            LifecycleStatus lifecycleStatus,
            Map<String, Object> proposedFields) {
        return new ResourceAttributes(type, id, ownerId, lifecycleStatus, Map.of(), proposedFields);
    }

    /**
     * Create resource attributes for a change to a stored record.
     * Owner and status are the stored ones: the gate applies to the record as it is now.
     */
    public static ResourceAttributes change(
            ResourceType type,
            String id,
            String ownerId,
            LifecycleStatus lifecycleStatus,
            Map<String, Object> currentFields,
            Map<String, Object> proposedFields) {
        return new ResourceAttributes(type, id, ownerId, lifecycleStatus, currentFields, proposedFields);
    }

    /**
     * Create bare resource attributes with no field values (type-level checks).
     */
    public static ResourceAttributes of(ResourceType type, String id, String ownerId, LifecycleStatus lifecycleStatus) {
        return new ResourceAttributes(type, id, ownerId, lifecycleStatus, Map.of(), Map.of());
    }

    /**
     * Names of proposed fields whose value differs from the stored one, sorted.
     * Fields absent from the proposal are unchanged. On create every non-null proposed field counts.
     */
    public Set<String> changedFields() {
        Set<String> names = new TreeSet<>(proposedFields.keySet());
        names.removeIf(name -> Objects.equals(currentFields.get(name), proposedFields.get(name)));
        return names;
    }

    public Object proposedValue(String field) {
        return proposedFields.get(field);
    }
}
