package com.deepansh.orchestrator.memory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB-backed memory: messages collection for turns, sessions collection
 * for the summary.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoMemoryStore implements MemoryStore {

    private final MessageRecordRepository messageRepository;
    private final SessionRecordRepository sessionRepository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public Optional<String> getSummary(String sessionId) {
        return sessionRepository.findById(sessionId)
                .map(SessionRecord::getSummary)
                .filter(s -> !s.isBlank());
    }

    @Override
    public List<ConversationTurn> getRecentTurns(String sessionId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ConversationTurn> turns = new ArrayList<>(messageRepository
                .findBySessionIdOrderByTimestampDesc(sessionId, PageRequest.of(0, limit))
                .stream()
                .map(MessageRecord::toTurn)
                .toList());
        Collections.reverse(turns);
        log.debug("Loaded {} recent turns for session={}", turns.size(), sessionId);
        return turns;
    }

    @Override
    public List<ConversationTurn> getAllTurns(String sessionId) {
        return messageRepository.findBySessionIdOrderByTimestampAsc(sessionId).stream()
                .map(MessageRecord::toTurn)
                .toList();
    }

    @Override
    public long countTurns(String sessionId) {
        return messageRepository.countBySessionId(sessionId);
    }

    @Override
    public void setSummary(String sessionId, String userId, String summary) {
        Query query = new Query(Criteria.where("_id").is(sessionId));
        Update update = new Update()
                .set("summary", summary)
                .set("userId", userId)
                .set("updatedAt", clock.instant())
                .setOnInsert("createdAt", clock.instant());
        mongoTemplate.upsert(query, update, SessionRecord.class);
        log.info("Session summary updated [sessionId={}, chars={}]", sessionId, summary.length());
    }
}
