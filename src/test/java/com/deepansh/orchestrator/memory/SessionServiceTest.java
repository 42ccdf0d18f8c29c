package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.exception.ResourceNotFoundException;
import com.deepansh.orchestrator.model.SessionResponse;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock SessionRecordRepository sessionRepository;
    @Mock MessageRecordRepository messageRepository;
    @Mock MongoTemplate mongoTemplate;

    private SessionService service;

    @BeforeEach
    void setUp() {
        service = new SessionService(sessionRepository, messageRepository, mongoTemplate,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void upsertSession_incrementsTurnCountWithoutTouchingItOnInsert() {
        SessionRecord stored = SessionRecord.builder().sessionId("s1").userId("u1").turnCount(3).build();
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(SessionRecord.class))).thenReturn(stored);

        SessionRecord result = service.upsertSession("s1", "u1");

        assertThat(result.getTurnCount()).isEqualTo(3);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).findAndModify(any(Query.class), update.capture(),
                any(FindAndModifyOptions.class), eq(SessionRecord.class));
        Document doc = update.getValue().getUpdateObject();
        assertThat(doc.get("$inc", Document.class)).containsEntry("turnCount", 1);
        assertThat(doc.get("$setOnInsert", Document.class))
                .containsKeys("userId", "createdAt")
                .doesNotContainKey("turnCount");
    }

    @Test
    void getSession_unknown_throwsNotFound() {
        when(sessionRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getSession("missing"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void describe_includesMessageCount() {
        when(sessionRepository.findById("s1")).thenReturn(Optional.of(SessionRecord.builder()
                .sessionId("s1").userId("u1").summary("USER: hi").turnCount(2).createdAt(NOW).build()));
        when(messageRepository.countBySessionId("s1")).thenReturn(4L);

        SessionResponse response = service.describe("s1");

        assertThat(response.getMessageCount()).isEqualTo(4);
        assertThat(response.getTurnCount()).isEqualTo(2);
        assertThat(response.getSummary()).isEqualTo("USER: hi");
    }

    @Test
    void userSessions_mapsEachSession() {
        when(sessionRepository.findByUserIdOrderByUpdatedAtDesc("u1")).thenReturn(List.of(
                SessionRecord.builder().sessionId("b").userId("u1").build(),
                SessionRecord.builder().sessionId("a").userId("u1").build()));

        assertThat(service.userSessions("u1")).extracting(SessionResponse::getSessionId)
                .containsExactly("b", "a");
    }
}
