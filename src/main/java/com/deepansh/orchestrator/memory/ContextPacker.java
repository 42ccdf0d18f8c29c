package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the bounded textual context handed to the pipeline.
 *
 * Layout, in order, joined with newlines:
 * <pre>
 *   preamble
 *   [Session Summary]      only when a summary exists
 *   [Recent Conversation]  only when turns exist, one "ROLE: content" line each
 *   [Current Request]      "USER: prompt"
 * </pre>
 *
 * When the estimate exceeds the token budget and the session holds more than
 * K turns, the whole history is re-summarized, persisted, and the context is
 * rebuilt exactly once. The rebuilt context may still exceed the budget.
 */
@Component
@Slf4j
public class ContextPacker {

    static final String PREAMBLE =
            "You are a helpful AI assistant. Answer based on conversation history and current request.";

    private final MemoryStore memoryStore;
    private final Summarizer summarizer;
    private final OrchestratorProperties.Context config;

    public ContextPacker(MemoryStore memoryStore, Summarizer summarizer, OrchestratorProperties properties) {
        this.memoryStore = memoryStore;
        this.summarizer = summarizer;
        this.config = properties.getContext();
    }

    public PackedContext pack(String sessionId, String userId, String currentPrompt) {
        String summary = memoryStore.getSummary(sessionId).orElse(null);
        List<ConversationTurn> recent = memoryStore.getRecentTurns(sessionId, config.getRecentTurns());

        String context = assemble(summary, recent, currentPrompt);
        int estimate = estimateTokens(context);

        if (estimate > config.getTokenBudget()
                && memoryStore.countTurns(sessionId) > config.getRecentTurns()) {
            log.info("Context over budget, re-summarizing [sessionId={}, estimate={}, budget={}]",
                    sessionId, estimate, config.getTokenBudget());

            List<ConversationTurn> all = memoryStore.getAllTurns(sessionId);
            String newSummary = summarizer.summarize(all, config.getSummaryTargetTokens());
            memoryStore.setSummary(sessionId, userId, newSummary);

            String rebuilt = assemble(newSummary, recent, currentPrompt);
            int rebuiltEstimate = estimateTokens(rebuilt);
            log.debug("Context rebuilt [sessionId={}, estimate={} -> {}]", sessionId, estimate, rebuiltEstimate);
            return new PackedContext(rebuilt, newSummary, recent, rebuiltEstimate, true);
        }

        log.debug("Context packed [sessionId={}, turns={}, estimate={}]", sessionId, recent.size(), estimate);
        return new PackedContext(context, summary, recent, estimate, false);
    }

    static String assemble(String summary, List<ConversationTurn> turns, String currentPrompt) {
        List<String> parts = new ArrayList<>();
        parts.add(PREAMBLE);

        if (summary != null && !summary.isBlank()) {
            parts.add("\n[Session Summary]\n" + summary);
        }

        if (!turns.isEmpty()) {
            parts.add("\n[Recent Conversation]");
            for (ConversationTurn turn : turns) {
                parts.add(turn.formatLine());
            }
        }

        parts.add("\n[Current Request]\nUSER: " + currentPrompt);
        return String.join("\n", parts);
    }

    /** Rough size: one token per four characters, rounded up. */
    public static int estimateTokens(String text) {
        return (text.length() + 3) / 4;
    }
}
