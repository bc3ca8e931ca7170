package com.example.bloodlink.store.model;

public enum DonationType {
    WHOLE_BLOOD,
    PLATELETS,
    PLASMA,
    POWER_RED
}
