package com.example.bloodlink.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@EnableReactiveMongoRepositories(basePackages = "com.example.bloodlink.store.repository")
public class MongoConfig {
    // Indexes are auto-created by Spring Data MongoDB from @Indexed when spring.data.mongodb.auto-index-creation is on
}
