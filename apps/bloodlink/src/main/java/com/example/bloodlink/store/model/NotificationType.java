package com.example.bloodlink.store.model;

/**
 * Category of a user notification, used by clients to pick an icon and route the link.
 */
public enum NotificationType {
    MATCH,
    CAMPAIGN,
    URGENT,
    INFO,
    REQUEST_UPDATE
}
