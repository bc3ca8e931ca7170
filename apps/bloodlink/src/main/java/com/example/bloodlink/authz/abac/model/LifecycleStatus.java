package com.example.bloodlink.authz.abac.model;

/**
 * Status field of a resource that moves through a fixed sequence of states.
 * Implemented by the status enums of resources whose permitted actions depend on state.
 */
public interface LifecycleStatus {

    /**
     * Constant name of the state.
     */
    String name();

    /**
     * Human-readable state name as shown to users.
     */
    String label();
}
