package com.example.bloodlink.authz.abac.policy;

/**
 * A named condition that, when it holds, authorizes an action.
 * Grants listed for the same action are OR-combined.
 */
public record Grant(String name, Condition condition) {

    public static Grant of(String name, Condition condition) {
        return new Grant(name, condition);
    }
}
