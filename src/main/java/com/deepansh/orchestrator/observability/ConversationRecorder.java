package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.core.ToolCallLog;
import com.deepansh.orchestrator.exception.PersistenceException;
import com.deepansh.orchestrator.memory.MessageRecord;
import com.deepansh.orchestrator.memory.MessageRecordRepository;
import com.deepansh.orchestrator.stream.DoneTimings;
import com.deepansh.orchestrator.stream.TurnCommitter;
import com.deepansh.orchestrator.tool.DatabaseTools;
import com.deepansh.orchestrator.tool.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one conversational turn to the store.
 *
 * The user message goes in before the pipeline starts; everything the
 * pipeline produced (assistant message, suggestions, metrics, tool calls)
 * goes in through {@link #commit}, which the event relay calls only for a
 * run that finished with the client still connected. Unlike trace writes,
 * failures here propagate: the relay reports them as the stream's error.
 * A failed or abandoned commit is compensated by deleting what it wrote.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationRecorder implements TurnCommitter {

    private final MessageRecordRepository messageRepository;
    private final SuggestionRecordRepository suggestionRepository;
    private final MetricsRecordRepository metricsRepository;
    private final ToolCallRecordRepository toolCallRepository;
    private final DatabaseTools databaseTools;
    private final Clock clock;

    public MessageRecord saveUserMessage(String sessionId, String userId, String prompt) {
        MessageRecord saved = messageRepository.save(MessageRecord.builder()
                .sessionId(sessionId)
                .userId(userId)
                .role("user")
                .content(prompt)
                .createdAt(clock.instant())
                .timestamp(clock.millis())
                .build());
        log.debug("User message saved [sessionId={}, messageId={}]", sessionId, saved.getId());
        return saved;
    }

    /**
     * Writes the assistant message, suggestions, metrics and tool calls.
     * Ids are assigned before each write so that, if any write fails, the
     * ones already made (including one whose acknowledgement was lost) are
     * deleted before the failure propagates.
     */
    @Override
    public CommittedTurn commit(RequestState state, DoneTimings timings) {
        WrittenTurn written = new WrittenTurn(state.getSessionId());
        try {
            write(state, timings, written);
        } catch (RuntimeException e) {
            try {
                written.rollback();
            } catch (PersistenceException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
        log.info("Turn persisted [sessionId={}, messageId={}, toolCalls={}]",
                state.getSessionId(), written.messageId, written.toolCallIds.size());
        return written;
    }

    private void write(RequestState state, DoneTimings timings, WrittenTurn written) {
        String sessionId = state.getSessionId();
        String userId = state.getUserId();

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("suggestions", state.getSuggestions());
        metadata.put("timings", state.getTimings());
        metadata.put("ttftMs", timings.ttftMs());
        metadata.put("totalMs", timings.totalMs());

        written.messageId = newId();
        messageRepository.save(MessageRecord.builder()
                .id(written.messageId)
                .sessionId(sessionId)
                .userId(userId)
                .role("assistant")
                .content(state.getFinalAnswer())
                .metadata(metadata)
                .createdAt(clock.instant())
                .timestamp(clock.millis())
                .build());

        written.suggestionId = newId();
        suggestionRepository.save(SuggestionRecord.builder()
                .id(written.suggestionId)
                .sessionId(sessionId)
                .userId(userId)
                .messageId(written.messageId)
                .suggestions(state.getSuggestions())
                .createdAt(clock.instant())
                .build());

        written.metricsId = newId();
        metricsRepository.save(MetricsRecord.builder()
                .id(written.metricsId)
                .sessionId(sessionId)
                .userId(userId)
                .messageId(written.messageId)
                .ttftMs(timings.ttftMs())
                .totalMs(timings.totalMs())
                .toolCallCount(state.getToolCalls().size())
                .agentTimings(state.getTimings())
                .timestamp(clock.millis())
                .build());

        for (ToolCallLog call : state.getToolCalls()) {
            ObjectId id = new ObjectId();
            written.toolCallIds.add(id.toHexString());
            QueryResult result = databaseTools.insert(ToolCallRecord.COLLECTION, toDocument(id, state, call));
            if (!result.isOk()) {
                throw new PersistenceException("Failed to record tool call " + call.tool() + ": " + result.error());
            }
        }
    }

    private static String newId() {
        return new ObjectId().toHexString();
    }

    /** Ids of everything one commit wrote or attempted to write. */
    private final class WrittenTurn implements CommittedTurn {

        private final String sessionId;
        private String messageId;
        private String suggestionId;
        private String metricsId;
        private final List<String> toolCallIds = new ArrayList<>();

        WrittenTurn(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void rollback() {
            List<RuntimeException> failures = new ArrayList<>();
            if (!toolCallIds.isEmpty()) {
                attempt(failures, () -> toolCallRepository.deleteAllById(toolCallIds));
            }
            if (metricsId != null) {
                attempt(failures, () -> metricsRepository.deleteById(metricsId));
            }
            if (suggestionId != null) {
                attempt(failures, () -> suggestionRepository.deleteById(suggestionId));
            }
            if (messageId != null) {
                attempt(failures, () -> messageRepository.deleteById(messageId));
            }

            if (!failures.isEmpty()) {
                PersistenceException e = new PersistenceException(
                        "Rollback of turn left records behind [sessionId=" + sessionId + "]");
                failures.forEach(e::addSuppressed);
                throw e;
            }
            log.warn("Turn rolled back [sessionId={}, messageId={}, toolCalls={}]",
                    sessionId, messageId, toolCallIds.size());
        }

        private void attempt(List<RuntimeException> failures, Runnable delete) {
            try {
                delete.run();
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
    }

    private static Map<String, Object> toDocument(ObjectId id, RequestState state, ToolCallLog call) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("_id", id);
        doc.put("sessionId", state.getSessionId());
        doc.put("userId", state.getUserId());
        doc.put("tool", call.tool());
        doc.put("args", call.args());
        doc.put("status", call.result().status().value());
        doc.put("count", call.result().count());
        doc.put("error", call.result().error());
        doc.put("latencyMs", call.latencyMs());
        doc.put("timestamp", call.timestamp());
        return doc;
    }
}
