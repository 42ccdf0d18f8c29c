package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.memory.ConversationTurn;
import com.deepansh.orchestrator.memory.PackedContext;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one request carries through the pipeline.
 *
 * Immutable: each stage receives a state and returns a new one built with
 * {@link #toBuilder()}. Owned by exactly one in-flight request and dropped
 * once the relay has emitted its terminal event.
 *
 * Ownership of fields by writer:
 * - context packer: context, summary, recentTurns
 * - planner: subtasks, dataAccessPlan
 * - executor: findings, toolCalls (both only ever appended to)
 * - validator: validationPassed, validationFeedback, retryCount
 * - composer: finalAnswer, suggestions, completedAt
 * - relay: firstTokenAt
 */
@Value
@Builder(toBuilder = true)
public class RequestState {

    String sessionId;
    String userId;
    String userPrompt;

    @Builder.Default
    String context = "";
    String summary;
    @Builder.Default
    List<ConversationTurn> recentTurns = List.of();

    @Builder.Default
    List<String> subtasks = List.of();
    @Builder.Default
    String dataAccessPlan = "";

    @Builder.Default
    List<Finding> findings = List.of();
    @Builder.Default
    List<ToolCallLog> toolCalls = List.of();

    boolean validationPassed;
    @Builder.Default
    String validationFeedback = "";
    int retryCount;

    @Builder.Default
    String finalAnswer = "";
    @Builder.Default
    List<String> suggestions = List.of();

    /** Stage name to elapsed ms, in first-execution order. */
    @Builder.Default
    Map<String, Long> timings = Map.of();
    long requestStart;
    Long firstTokenAt;
    Long completedAt;

    String currentAgent;

    public static RequestState initial(String sessionId,
                                       String userId,
                                       String userPrompt,
                                       PackedContext packed,
                                       long requestStart) {
        return RequestState.builder()
                .sessionId(sessionId)
                .userId(userId)
                .userPrompt(userPrompt)
                .context(packed.context())
                .summary(packed.summary())
                .recentTurns(packed.recentTurns())
                .requestStart(requestStart)
                .build();
    }

    /**
     * Returns a copy with the stage's elapsed time recorded and the stage marked current.
     * A stage that runs twice (executor, validator on retry) accumulates its time.
     */
    public RequestState withStageTiming(Stage stage, long elapsedMs) {
        Map<String, Long> merged = new LinkedHashMap<>(timings);
        merged.merge(stage.wireName(), elapsedMs, Long::sum);
        return toBuilder()
                .timings(Collections.unmodifiableMap(merged))
                .currentAgent(stage.wireName())
                .build();
    }

    public RequestState withFindingsAppended(List<Finding> added, List<ToolCallLog> addedCalls) {
        List<Finding> f = new ArrayList<>(findings);
        f.addAll(added);
        List<ToolCallLog> c = new ArrayList<>(toolCalls);
        c.addAll(addedCalls);
        return toBuilder()
                .findings(List.copyOf(f))
                .toolCalls(List.copyOf(c))
                .build();
    }

    public long failedToolCallCount() {
        return toolCalls.stream().filter(tc -> !tc.ok()).count();
    }
}
