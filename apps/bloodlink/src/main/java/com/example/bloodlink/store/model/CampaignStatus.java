package com.example.bloodlink.store.model;

import com.example.bloodlink.authz.abac.model.LifecycleStatus;

public enum CampaignStatus implements LifecycleStatus {
    UPCOMING("Upcoming"),
    ONGOING("Ongoing"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled");

    private final String label;

    CampaignStatus(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }
}
