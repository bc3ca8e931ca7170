package com.example.bloodlink.store.repository;

import com.example.bloodlink.store.document.UserProfileDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

// ID is the subject id from the authentication provider
@Repository
public interface UserProfileRepository extends ReactiveMongoRepository<UserProfileDoc, String> {
}
