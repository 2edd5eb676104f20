package com.deepansh.inbox.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate on run traces is populated on save.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.deepansh.inbox.observability")
public class MongoConfig {
}
