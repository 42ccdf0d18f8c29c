package com.deepansh.orchestrator.observability;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SuggestionRecordRepository extends MongoRepository<SuggestionRecord, String> {

    Optional<SuggestionRecord> findFirstByMessageId(String messageId);

    List<SuggestionRecord> findBySessionIdOrderByCreatedAtDesc(String sessionId, Pageable pageable);
}
