package com.deepansh.orchestrator.observability;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ToolCallRecordRepository extends MongoRepository<ToolCallRecord, String> {
}
