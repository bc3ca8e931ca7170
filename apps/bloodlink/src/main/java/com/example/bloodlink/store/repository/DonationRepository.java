package com.example.bloodlink.store.repository;

import com.example.bloodlink.store.document.DonationDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface DonationRepository extends ReactiveMongoRepository<DonationDoc, String> {

    /**
     * Find a donor's history, newest first.
     */
    Flux<DonationDoc> findByDonorUidOrderByDonationDateDesc(String donorUid);
}
