package com.example.bloodlink.store.model;

import com.example.bloodlink.authz.abac.model.LifecycleStatus;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a blood request, from submission to closure.
 */
public enum RequestStatus implements LifecycleStatus {
    PENDING_VERIFICATION("Pending Verification"),
    PENDING("Pending"),
    ACTIVE("Active"),
    PARTIALLY_FULFILLED("Partially Fulfilled"),
    FULFILLED("Fulfilled"),
    CANCELLED("Cancelled"),
    EXPIRED("Expired");

    /**
     * States in which the requester may still edit or cancel the request.
     */
    public static final Set<RequestStatus> EDITABLE =
            Set.copyOf(EnumSet.of(PENDING_VERIFICATION, PENDING, ACTIVE));

    /**
     * States in which any authenticated user may see the request.
     */
    public static final Set<RequestStatus> PUBLICLY_VISIBLE =
            Set.copyOf(EnumSet.of(ACTIVE, PARTIALLY_FULFILLED, FULFILLED));

    private final String label;

    RequestStatus(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }
}
