package com.example.bloodlink.store.repository;

import com.example.bloodlink.store.document.CampaignDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CampaignRepository extends ReactiveMongoRepository<CampaignDoc, String> {
}
