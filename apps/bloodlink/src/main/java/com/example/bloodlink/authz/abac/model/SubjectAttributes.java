package com.example.bloodlink.authz.abac.model;

import com.example.bloodlink.store.model.UserRole;

/**
 * ABAC Subject Attributes - the caller making the request.
 *
 * <p>An anonymous subject has neither id nor role. The role is resolved once per request
 * by {@link com.example.bloodlink.authz.identity.SubjectResolver}, so policies never look it up.
 */
public record SubjectAttributes(
        String subjectId,
        UserRole role
) {
    private static final SubjectAttributes ANONYMOUS = new SubjectAttributes(null, null);

    public SubjectAttributes {
        if (subjectId == null || subjectId.isBlank()) {
            subjectId = null;
            role = null;
        }
    }

    public static SubjectAttributes anonymous() {
        return ANONYMOUS;
    }

    /**
     * Create subject attributes for an authenticated caller. A blank id yields the anonymous subject.
     */
    public static SubjectAttributes of(String subjectId, UserRole role) {
        return new SubjectAttributes(subjectId, role);
    }

    public boolean isAuthenticated() {
        return subjectId != null;
    }

    public boolean isAdmin() {
        return isAuthenticated() && role == UserRole.ADMIN;
    }

    /**
     * Check if this subject is the owner referenced by a resource.
     */
    public boolean isSubject(String ownerId) {
        return isAuthenticated() && subjectId.equals(ownerId);
    }

    /**
     * Identifier for logs; never null.
     */
    public String displayId() {
        return isAuthenticated() ? subjectId : "anonymous";
    }
}
