package com.deepansh.orchestrator.memory;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MessageRecordRepository extends MongoRepository<MessageRecord, String> {

    List<MessageRecord> findBySessionIdOrderByTimestampAsc(String sessionId);

    List<MessageRecord> findBySessionIdOrderByTimestampAsc(String sessionId, Pageable pageable);

    /** Newest first; callers reverse to get chronological order. */
    List<MessageRecord> findBySessionIdOrderByTimestampDesc(String sessionId, Pageable pageable);

    long countBySessionId(String sessionId);
}
