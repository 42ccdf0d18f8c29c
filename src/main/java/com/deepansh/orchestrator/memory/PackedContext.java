package com.deepansh.orchestrator.memory;

import java.util.List;

/**
 * Output of {@link ContextPacker#pack}.
 *
 * @param context        assembled prompt context
 * @param summary        session summary in effect (new one if it was regenerated), null if none
 * @param recentTurns    last K turns, oldest first
 * @param tokenEstimate  ceil(context length / 4)
 * @param summaryUpdated true when this call regenerated and persisted the summary
 */
public record PackedContext(String context,
                            String summary,
                            List<ConversationTurn> recentTurns,
                            int tokenEstimate,
                            boolean summaryUpdated) {

    public PackedContext {
        recentTurns = recentTurns != null ? List.copyOf(recentTurns) : List.of();
    }
}
