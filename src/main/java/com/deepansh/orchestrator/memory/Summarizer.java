package com.deepansh.orchestrator.memory;

import java.util.List;

/**
 * Condenses a conversation into a bounded summary for the context packer.
 */
public interface Summarizer {

    /**
     * @param turns        full history, oldest first
     * @param targetTokens approximate upper bound on the summary size
     */
    String summarize(List<ConversationTurn> turns, int targetTokens);

    /**
     * Caps text at {@code targetTokens * 4} characters, marking the cut with "...".
     */
    static String truncate(String text, int targetTokens) {
        int maxChars = targetTokens * 4;
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...";
    }
}
