package com.example.bloodlink.store.model;

public enum UrgencyLevel {
    CRITICAL,
    HIGH,
    MEDIUM,  // Default for new requests
    LOW
}
