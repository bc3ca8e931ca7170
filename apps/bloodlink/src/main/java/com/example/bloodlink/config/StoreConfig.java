package com.example.bloodlink.config;

import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.authz.abac.service.AbacAuthorizationService;
import com.example.bloodlink.store.document.BloodBankDoc;
import com.example.bloodlink.store.document.BloodRequestDoc;
import com.example.bloodlink.store.document.CampaignDoc;
import com.example.bloodlink.store.document.DonationDoc;
import com.example.bloodlink.store.document.NotificationDoc;
import com.example.bloodlink.store.document.UserProfileDoc;
import com.example.bloodlink.store.repository.BloodBankRepository;
import com.example.bloodlink.store.repository.BloodRequestRepository;
import com.example.bloodlink.store.repository.CampaignRepository;
import com.example.bloodlink.store.repository.DonationRepository;
import com.example.bloodlink.store.repository.NotificationRepository;
import com.example.bloodlink.store.repository.UserProfileRepository;
import com.example.bloodlink.store.service.PolicyEnforcedStore;
import com.example.bloodlink.store.service.RecordFieldExtractor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Flux;

/**
 * One policy-enforced store per resource type.
 */
@Configuration
public class StoreConfig {

    @Bean
    public PolicyEnforcedStore<UserProfileDoc> userProfileStore(
            UserProfileRepository repository,
            AbacAuthorizationService authorizationService,
            RecordFieldExtractor fieldExtractor) {
        // A profile is its own owner
        return new PolicyEnforcedStore<>(ResourceType.USER, repository, authorizationService, fieldExtractor,
                uid -> Flux.from(repository.findById(uid)));
    }

    @Bean
    public PolicyEnforcedStore<BloodBankDoc> bloodBankStore(
            BloodBankRepository repository,
            AbacAuthorizationService authorizationService,
            RecordFieldExtractor fieldExtractor) {
        return new PolicyEnforcedStore<>(ResourceType.BLOOD_BANK, repository, authorizationService, fieldExtractor,
                null);
    }

    @Bean
    public PolicyEnforcedStore<CampaignDoc> campaignStore(
            CampaignRepository repository,
            AbacAuthorizationService authorizationService,
            RecordFieldExtractor fieldExtractor) {
        return new PolicyEnforcedStore<>(ResourceType.CAMPAIGN, repository, authorizationService, fieldExtractor,
                null);
    }

    @Bean
    public PolicyEnforcedStore<BloodRequestDoc> bloodRequestStore(
            BloodRequestRepository repository,
            AbacAuthorizationService authorizationService,
            RecordFieldExtractor fieldExtractor) {
        return new PolicyEnforcedStore<>(ResourceType.BLOOD_REQUEST, repository, authorizationService, fieldExtractor,
                repository::findByRequesterUid);
    }

    @Bean
    public PolicyEnforcedStore<DonationDoc> donationStore(
            DonationRepository repository,
            AbacAuthorizationService authorizationService,
            RecordFieldExtractor fieldExtractor) {
        return new PolicyEnforcedStore<>(ResourceType.DONATION, repository, authorizationService, fieldExtractor,
                repository::findByDonorUidOrderByDonationDateDesc);
    }

    @Bean
    public PolicyEnforcedStore<NotificationDoc> notificationStore(
            NotificationRepository repository,
            AbacAuthorizationService authorizationService,
            RecordFieldExtractor fieldExtractor) {
        return new PolicyEnforcedStore<>(ResourceType.NOTIFICATION, repository, authorizationService, fieldExtractor,
                repository::findByUserUid);
    }
}
