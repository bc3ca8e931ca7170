package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.store.model.UserRole;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.bloodlink.authz.abac.policy.Conditions.admin;
import static com.example.bloodlink.authz.abac.policy.Conditions.self;

/**
 * Policy: user profiles.
 *
 * <pre>
 *   CREATE  self                (signup: the proposed uid is the caller's)
 *   READ    self OR admin
 *   UPDATE  self OR admin
 *   DELETE  admin
 * </pre>
 *
 * {@code uid} never changes. {@code role} is admin-only on update, and a self-created
 * profile may only claim the donor or recipient role.
 */
@Component
public class UserPolicy extends ResourcePolicy {

    public static final String FIELD_UID = "uid";
    public static final String FIELD_ROLE = "role";

    public UserPolicy() {
        super(ResourceType.USER,
                Map.of(
                        Action.CREATE, List.of(Grant.of("self", self())),
                        Action.READ, List.of(Grant.of("self", self()), Grant.of("admin", admin())),
                        Action.UPDATE, List.of(Grant.of("self", self()), Grant.of("admin", admin())),
                        Action.DELETE, List.of(Grant.of("admin", admin()))),
                List.of(
                        FieldGuard.immutable(FIELD_UID),
                        FieldGuard.adminOnly(FIELD_ROLE),
                        FieldGuard.nonAdminValues(FIELD_ROLE,
                                Set.of(UserRole.DONOR.name(), UserRole.RECIPIENT.name()))));
    }

    @Override
    public String getDescription() {
        return "Users manage their own profile; admins manage all profiles; role changes are admin-only";
    }
}
