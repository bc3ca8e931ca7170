package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.example.bloodlink.authz.abac.policy.Conditions.admin;
import static com.example.bloodlink.authz.abac.policy.Conditions.self;

/**
 * Policy: notifications. The recipient may mark them read; everything else is admin-only.
 */
@Component
public class NotificationPolicy extends ResourcePolicy {

    public static final String FIELD_IS_READ = "isRead";

    public NotificationPolicy() {
        super(ResourceType.NOTIFICATION,
                Map.of(
                        Action.CREATE, List.of(Grant.of("admin", admin())),
                        Action.READ, List.of(Grant.of("self", self()), Grant.of("admin", admin())),
                        Action.UPDATE, List.of(Grant.of("self", self()), Grant.of("admin", admin())),
                        Action.DELETE, List.of(Grant.of("admin", admin()))),
                List.of(
                        FieldGuard.immutable("id"),
                        FieldGuard.nonAdminMayOnlyChange(FIELD_IS_READ)));
    }

    @Override
    public String getDescription() {
        return "Users read and acknowledge their own notifications; admins send and manage them";
    }
}
