package com.deepansh.inbox.observability;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AgentRunTraceRepository extends MongoRepository<AgentRunTrace, String> {
}
