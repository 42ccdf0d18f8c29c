package com.deepansh.orchestrator.memory;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionRecordRepository extends MongoRepository<SessionRecord, String> {

    List<SessionRecord> findByUserIdOrderByUpdatedAtDesc(String userId);
}
