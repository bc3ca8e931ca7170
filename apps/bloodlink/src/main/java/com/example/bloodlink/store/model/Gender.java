package com.example.bloodlink.store.model;

public enum Gender {
    MALE,
    FEMALE
}
