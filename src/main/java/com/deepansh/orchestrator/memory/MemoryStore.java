package com.deepansh.orchestrator.memory;

import java.util.List;
import java.util.Optional;

/**
 * Read/write access to conversation history and the session summary,
 * as needed by {@link ContextPacker}.
 */
public interface MemoryStore {

    Optional<String> getSummary(String sessionId);

    /**
     * The {@code limit} most recent turns, oldest first.
     */
    List<ConversationTurn> getRecentTurns(String sessionId, int limit);

    /** Full history, oldest first. */
    List<ConversationTurn> getAllTurns(String sessionId);

    long countTurns(String sessionId);

    void setSummary(String sessionId, String userId, String summary);
}
