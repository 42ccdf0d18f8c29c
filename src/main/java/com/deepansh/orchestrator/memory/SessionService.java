package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.exception.ResourceNotFoundException;
import com.deepansh.orchestrator.model.SessionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Session documents: one per sessionId, created by the first chat turn.
 *
 * turnCount is only ever touched by $inc, and $setOnInsert only by fields
 * nothing else writes; MongoDB rejects two operators on one path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionService {

    private final SessionRecordRepository sessionRepository;
    private final MessageRecordRepository messageRepository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    /** Creates the session on first use and counts the turn. */
    public SessionRecord upsertSession(String sessionId, String userId) {
        Instant now = clock.instant();
        SessionRecord session = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(sessionId)),
                new Update()
                        .setOnInsert("userId", userId)
                        .setOnInsert("createdAt", now)
                        .set("updatedAt", now)
                        .inc("turnCount", 1),
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                SessionRecord.class);

        if (session == null) {
            throw new IllegalStateException("Session upsert returned nothing for " + sessionId);
        }
        if (!userId.equals(session.getUserId())) {
            log.warn("Session {} belongs to user {} but turn came from {}", sessionId, session.getUserId(), userId);
        }
        log.debug("Session turn counted [sessionId={}, turnCount={}]", sessionId, session.getTurnCount());
        return session;
    }

    public SessionRecord getSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session not found: " + sessionId));
    }

    public SessionResponse describe(String sessionId) {
        return toResponse(getSession(sessionId));
    }

    /** Most recently active first. */
    public List<SessionResponse> userSessions(String userId) {
        return sessionRepository.findByUserIdOrderByUpdatedAtDesc(userId).stream()
                .map(this::toResponse)
                .toList();
    }

    private SessionResponse toResponse(SessionRecord session) {
        return SessionResponse.builder()
                .sessionId(session.getSessionId())
                .userId(session.getUserId())
                .summary(session.getSummary())
                .turnCount(session.getTurnCount())
                .messageCount(messageRepository.countBySessionId(session.getSessionId()))
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build();
    }
}
