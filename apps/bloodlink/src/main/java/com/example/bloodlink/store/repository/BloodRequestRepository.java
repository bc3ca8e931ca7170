package com.example.bloodlink.store.repository;

import com.example.bloodlink.store.document.BloodRequestDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Reactive MongoDB repository for blood requests.
 */
@Repository
public interface BloodRequestRepository extends ReactiveMongoRepository<BloodRequestDoc, String> {

    /**
     * Find all requests submitted by a user.
     */
    Flux<BloodRequestDoc> findByRequesterUid(String requesterUid);
}
