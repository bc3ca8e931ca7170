package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.example.bloodlink.authz.abac.policy.Conditions.admin;
import static com.example.bloodlink.authz.abac.policy.Conditions.self;

/**
 * Policy: donations are recorded by staff. Donors can see their own history and nothing else.
 */
@Component
public class DonationPolicy extends ResourcePolicy {

    public DonationPolicy() {
        super(ResourceType.DONATION,
                Map.of(
                        Action.CREATE, List.of(Grant.of("admin", admin())),
                        Action.READ, List.of(Grant.of("self", self()), Grant.of("admin", admin())),
                        Action.UPDATE, List.of(Grant.of("admin", admin())),
                        Action.DELETE, List.of(Grant.of("admin", admin()))),
                List.of(FieldGuard.immutable("id")));
    }

    @Override
    public String getDescription() {
        return "Admins record and manage donations; donors view their own donation history";
    }
}
