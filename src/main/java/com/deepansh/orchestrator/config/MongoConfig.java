package com.deepansh.orchestrator.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Repositories live next to the documents they serve: conversation state
 * under memory, per-turn analytics under observability.
 */
@Configuration
@EnableMongoRepositories(basePackages = {
    "com.deepansh.orchestrator.memory",
    "com.deepansh.orchestrator.observability"
})
public class MongoConfig {
}
