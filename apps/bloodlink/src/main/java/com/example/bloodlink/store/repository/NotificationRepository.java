package com.example.bloodlink.store.repository;

import com.example.bloodlink.store.document.NotificationDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface NotificationRepository extends ReactiveMongoRepository<NotificationDoc, String> {

    Flux<NotificationDoc> findByUserUid(String userUid);
}
