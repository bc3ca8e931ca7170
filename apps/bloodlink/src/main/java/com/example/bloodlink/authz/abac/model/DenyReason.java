package com.example.bloodlink.authz.abac.model;

import java.util.Collection;

/**
 * Why a request was denied.
 *
 * <p>Declaration order is precedence: when several grants fail for different reasons,
 * the earliest constant here is reported.
 */
public enum DenyReason {
    NOT_AUTHENTICATED,
    INVALID_LIFECYCLE_STATE,
    NOT_OWNER,
    NOT_ADMIN,
    FIELD_NOT_UPDATABLE,
    UNSUPPORTED;

    /**
     * Picks the reason to report out of all failed conditions.
     *
     * @param failures reasons collected from every failed grant
     * @return the highest-precedence reason, or {@link #UNSUPPORTED} when nothing was collected
     */
    public static DenyReason mostSpecific(Collection<DenyReason> failures) {
        DenyReason result = UNSUPPORTED;
        for (DenyReason reason : failures) {
            if (reason != null && reason.ordinal() < result.ordinal()) {
                result = reason;
            }
        }
        return result;
    }
}
