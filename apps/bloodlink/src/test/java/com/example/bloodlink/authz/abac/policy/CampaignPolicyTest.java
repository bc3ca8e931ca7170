package com.example.bloodlink.authz.abac.policy;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.DenyReason;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.bloodlink.util.SubjectAttributesTestBuilder.aRecipient;
import static com.example.bloodlink.util.SubjectAttributesTestBuilder.anAdmin;
import static com.example.bloodlink.util.SubjectAttributesTestBuilder.anonymous;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CampaignPolicy")
class CampaignPolicyTest {

    private static final Map<String, Object> STORED = Map.of("id", "camp-1", "title", "Winter Drive");

    private CampaignPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new CampaignPolicy();
    }

    @Test
    @DisplayName("should let anyone read the campaign without signing in")
    void shouldAllowPublicRead() {
        ResourceAttributes stored = ResourceAttributes.stored(ResourceType.CAMPAIGN, "camp-1", null, null, STORED);

        PolicyDecision decision = policy.evaluate(anonymous(), stored, Action.READ);

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.message()).contains("granted by public");
    }

    @Test
    @DisplayName("should deny a signed-in recipient updating the campaign with NOT_ADMIN")
    void shouldDenyRecipientUpdate() {
        ResourceAttributes change = ResourceAttributes.change(ResourceType.CAMPAIGN, "camp-1", null, null,
                STORED, Map.of("title", "Spring Drive"));

        PolicyDecision recipient = policy.evaluate(aRecipient("r1"), change, Action.UPDATE);
        PolicyDecision admin = policy.evaluate(anAdmin(), change, Action.UPDATE);

        assertThat(recipient.reason()).isEqualTo(DenyReason.NOT_ADMIN);
        assertThat(admin.isAllowed()).isTrue();
    }

    @Test
    @DisplayName("should deny anonymous writes with NOT_AUTHENTICATED")
    void shouldDenyAnonymousWrites() {
        ResourceAttributes proposed = ResourceAttributes.proposed(ResourceType.CAMPAIGN, null, null, null,
                Map.of("title", "Spring Drive"));
        ResourceAttributes stored = ResourceAttributes.stored(ResourceType.CAMPAIGN, "camp-1", null, null, STORED);

        assertThat(policy.evaluate(anonymous(), proposed, Action.CREATE).reason())
                .isEqualTo(DenyReason.NOT_AUTHENTICATED);
        assertThat(policy.evaluate(anonymous(), stored, Action.DELETE).reason())
                .isEqualTo(DenyReason.NOT_AUTHENTICATED);
    }
}
