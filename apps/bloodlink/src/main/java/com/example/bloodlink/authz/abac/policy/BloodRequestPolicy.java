package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.store.model.RequestStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.example.bloodlink.authz.abac.policy.Conditions.admin;
import static com.example.bloodlink.authz.abac.policy.Conditions.authenticated;
import static com.example.bloodlink.authz.abac.policy.Conditions.self;
import static com.example.bloodlink.authz.abac.policy.Conditions.statusIn;

/**
 * Policy: blood requests, gated by request status.
 *
 * <pre>
 *   CREATE  (authenticated AND self on the proposed request) OR admin
 *   READ    self OR admin OR (authenticated AND status IN publicly visible)
 *   UPDATE  (self AND status IN editable) OR admin
 *   DELETE  self OR admin
 * </pre>
 *
 * Once a request leaves the editable states only an admin may change it.
 * Only an admin may reassign {@code requesterUid}.
 */
@Component
public class BloodRequestPolicy extends ResourcePolicy {

    public static final String FIELD_REQUESTER_UID = "requesterUid";

    public BloodRequestPolicy() {
        super(ResourceType.BLOOD_REQUEST,
                Map.of(
                        Action.CREATE, List.of(
                                Grant.of("own-request", authenticated().and(self())),
                                Grant.of("admin", admin())),
                        Action.READ, List.of(
                                Grant.of("self", self()),
                                Grant.of("admin", admin()),
                                Grant.of("publicly-visible",
                                        authenticated().and(statusIn(RequestStatus.PUBLICLY_VISIBLE)))),
                        Action.UPDATE, List.of(
                                Grant.of("self-while-editable", self().and(statusIn(RequestStatus.EDITABLE))),
                                Grant.of("admin", admin())),
                        Action.DELETE, List.of(
                                Grant.of("self", self()),
                                Grant.of("admin", admin()))),
                List.of(
                        FieldGuard.immutable("id"),
                        FieldGuard.adminOnly(FIELD_REQUESTER_UID)));
    }

    @Override
    public String getDescription() {
        return "Requesters manage their own requests while editable; active requests are visible to signed-in users";
    }
}
