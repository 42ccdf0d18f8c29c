package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.core.ToolCallLog;
import com.deepansh.orchestrator.exception.PersistenceException;
import com.deepansh.orchestrator.memory.MessageRecord;
import com.deepansh.orchestrator.memory.MessageRecordRepository;
import com.deepansh.orchestrator.stream.DoneTimings;
import com.deepansh.orchestrator.tool.DatabaseTools;
import com.deepansh.orchestrator.tool.QueryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationRecorderTest {

    @Mock MessageRecordRepository messageRepository;
    @Mock SuggestionRecordRepository suggestionRepository;
    @Mock MetricsRecordRepository metricsRepository;
    @Mock ToolCallRecordRepository toolCallRepository;
    @Mock DatabaseTools databaseTools;

    private ConversationRecorder recorder;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(9_000), ZoneOffset.UTC);
        recorder = new ConversationRecorder(messageRepository, suggestionRepository,
                metricsRepository, toolCallRepository, databaseTools, clock);
    }

    @Test
    void saveUserMessage_storesUserRoleWithTimestamp() {
        when(messageRepository.save(any(MessageRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        MessageRecord saved = recorder.saveUserMessage("s1", "u1", "Hello");

        assertThat(saved.getRole()).isEqualTo("user");
        assertThat(saved.getContent()).isEqualTo("Hello");
        assertThat(saved.getTimestamp()).isEqualTo(9_000L);
    }

    @Test
    void commit_persistsAnswerSuggestionsMetricsAndToolCalls() {
        when(databaseTools.insert(eq("tool_calls"), anyMap())).thenReturn(QueryResult.written(1, 0.4));

        recorder.commit(finalState(), new DoneTimings(1_000, 1_200L, 2_000, 200L, 1_000));

        ArgumentCaptor<MessageRecord> message = ArgumentCaptor.forClass(MessageRecord.class);
        verify(messageRepository).save(message.capture());
        String messageId = message.getValue().getId();
        assertThat(messageId).isNotBlank();
        assertThat(message.getValue().getRole()).isEqualTo("assistant");
        assertThat(message.getValue().getMetadata())
                .containsEntry("ttftMs", 200L)
                .containsEntry("totalMs", 1_000L)
                .containsEntry("suggestions", List.of("a", "b", "c"));

        ArgumentCaptor<SuggestionRecord> suggestion = ArgumentCaptor.forClass(SuggestionRecord.class);
        verify(suggestionRepository).save(suggestion.capture());
        assertThat(suggestion.getValue().getMessageId()).isEqualTo(messageId);
        assertThat(suggestion.getValue().getSuggestions()).hasSize(3);

        ArgumentCaptor<MetricsRecord> metrics = ArgumentCaptor.forClass(MetricsRecord.class);
        verify(metricsRepository).save(metrics.capture());
        assertThat(metrics.getValue().getMessageId()).isEqualTo(messageId);
        assertThat(metrics.getValue().getToolCallCount()).isEqualTo(1);
        assertThat(metrics.getValue().getAgentTimings()).containsEntry("planner", 4L);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> doc = ArgumentCaptor.forClass(Map.class);
        verify(databaseTools).insert(eq("tool_calls"), doc.capture());
        assertThat(doc.getValue())
                .containsKey("_id")
                .containsEntry("sessionId", "s1")
                .containsEntry("tool", "db.find")
                .containsEntry("status", "ok")
                .containsEntry("count", 0);
    }

    @Test
    void commit_toolCallInsertFails_deletesEarlierWritesAndThrows() {
        when(databaseTools.insert(eq("tool_calls"), anyMap())).thenReturn(QueryResult.error("disk full", 1));

        assertThatThrownBy(() -> recorder.commit(finalState(), new DoneTimings(0, null, 10, null, 10)))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("disk full");

        ArgumentCaptor<MessageRecord> message = ArgumentCaptor.forClass(MessageRecord.class);
        verify(messageRepository).save(message.capture());
        verify(messageRepository).deleteById(message.getValue().getId());
        verify(suggestionRepository).deleteById(anyString());
        verify(metricsRepository).deleteById(anyString());
        verify(toolCallRepository).deleteAllById(argThat(ids -> ids.iterator().hasNext()));
    }

    @Test
    void commit_metricsWriteFails_deletesMessageAndSuggestionOnly() {
        when(metricsRepository.save(any(MetricsRecord.class)))
                .thenThrow(new IllegalStateException("write concern failed"));

        assertThatThrownBy(() -> recorder.commit(finalState(), new DoneTimings(0, null, 10, null, 10)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("write concern failed");

        ArgumentCaptor<MessageRecord> message = ArgumentCaptor.forClass(MessageRecord.class);
        verify(messageRepository).save(message.capture());
        ArgumentCaptor<SuggestionRecord> suggestion = ArgumentCaptor.forClass(SuggestionRecord.class);
        verify(suggestionRepository).save(suggestion.capture());
        verify(messageRepository).deleteById(message.getValue().getId());
        verify(suggestionRepository).deleteById(suggestion.getValue().getId());
        verify(databaseTools, never()).insert(anyString(), anyMap());
        verify(toolCallRepository, never()).deleteAllById(any());
    }

    @Test
    void commit_rollbackAlsoFails_keepsOriginalErrorWithSuppressedCause() {
        when(metricsRepository.save(any(MetricsRecord.class)))
                .thenThrow(new IllegalStateException("write concern failed"));
        doThrow(new IllegalStateException("store down")).when(messageRepository).deleteById(anyString());

        assertThatThrownBy(() -> recorder.commit(finalState(), new DoneTimings(0, null, 10, null, 10)))
                .hasMessage("write concern failed")
                .satisfies(e -> {
                    assertThat(e.getSuppressed()).hasSize(1);
                    assertThat(e.getSuppressed()[0]).isInstanceOf(PersistenceException.class);
                });
    }

    @Test
    void rollback_afterSuccessfulCommit_deletesEveryRecord() {
        when(databaseTools.insert(eq("tool_calls"), anyMap())).thenReturn(QueryResult.written(1, 0.4));

        recorder.commit(finalState(), new DoneTimings(0, 5L, 10, 5L, 10)).rollback();

        ArgumentCaptor<MessageRecord> message = ArgumentCaptor.forClass(MessageRecord.class);
        verify(messageRepository).save(message.capture());
        verify(messageRepository).deleteById(message.getValue().getId());
        verify(suggestionRepository).deleteById(anyString());
        verify(metricsRepository).deleteById(anyString());
        verify(toolCallRepository).deleteAllById(any());
    }

    private static RequestState finalState() {
        return RequestState.builder()
                .sessionId("s1")
                .userId("u1")
                .userPrompt("hi")
                .finalAnswer("Hello!")
                .suggestions(List.of("a", "b", "c"))
                .toolCalls(List.of(new ToolCallLog("db.find", Map.of("collection", "messages"),
                        QueryResult.ok(List.of(), 0.5), 0.5, 100L)))
                .timings(Map.of("planner", 4L))
                .build();
    }
}
