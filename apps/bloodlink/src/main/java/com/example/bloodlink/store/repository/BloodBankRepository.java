package com.example.bloodlink.store.repository;

import com.example.bloodlink.store.document.BloodBankDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BloodBankRepository extends ReactiveMongoRepository<BloodBankDoc, String> {
}
