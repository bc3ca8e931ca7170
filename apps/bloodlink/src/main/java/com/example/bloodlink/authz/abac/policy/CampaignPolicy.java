package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.example.bloodlink.authz.abac.policy.Conditions.admin;
import static com.example.bloodlink.authz.abac.policy.Conditions.anyone;

@Component
public class CampaignPolicy extends ResourcePolicy {

    public CampaignPolicy() {
        super(ResourceType.CAMPAIGN,
                Map.of(
                        Action.CREATE, List.of(Grant.of("admin", admin())),
                        Action.READ, List.of(Grant.of("public", anyone())),
                        Action.UPDATE, List.of(Grant.of("admin", admin())),
                        Action.DELETE, List.of(Grant.of("admin", admin()))),
                List.of(FieldGuard.immutable("id")));
    }

    @Override
    public String getDescription() {
        return "Anyone can view donation campaigns; only admins manage them";
    }
}
