package com.deepansh.orchestrator.memory;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary built from message counts and the first/last user messages.
 * No model call; output depends only on the turns.
 */
public class HeuristicSummarizer implements Summarizer {

    private static final int EXCERPT_CHARS = 100;

    @Override
    public String summarize(List<ConversationTurn> turns, int targetTokens) {
        List<ConversationTurn> userTurns = turns.stream().filter(ConversationTurn::isUser).toList();
        long assistantCount = turns.stream().filter(ConversationTurn::isAssistant).count();

        List<String> parts = new ArrayList<>();
        parts.add("Conversation history: " + turns.size() + " total messages");
        parts.add("User asked about: " + userTurns.size() + " topics");
        parts.add("Assistant provided: " + assistantCount + " responses");

        if (!userTurns.isEmpty()) {
            parts.add("Initial topic: " + excerpt(userTurns.get(0)) + "...");
            if (userTurns.size() > 1) {
                parts.add("Recent topic: " + excerpt(userTurns.get(userTurns.size() - 1)) + "...");
            }
        }

        return Summarizer.truncate(String.join(" | ", parts), targetTokens);
    }

    private static String excerpt(ConversationTurn turn) {
        String content = turn.content() != null ? turn.content() : "";
        return content.length() <= EXCERPT_CHARS ? content : content.substring(0, EXCERPT_CHARS);
    }
}
