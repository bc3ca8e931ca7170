package com.example.bloodlink.store.model;

/**
 * Role assigned to a platform user. Stored on the user profile and resolved once per request.
 */
public enum UserRole {
    DONOR,
    RECIPIENT,  // Default for new profiles
    ADMIN
}
