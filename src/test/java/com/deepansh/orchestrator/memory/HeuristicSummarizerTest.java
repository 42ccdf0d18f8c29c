package com.deepansh.orchestrator.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicSummarizerTest {

    private final HeuristicSummarizer summarizer = new HeuristicSummarizer();

    @Test
    void summarize_countsRolesAndQuotesFirstAndLastUserMessages() {
        List<ConversationTurn> turns = List.of(
                new ConversationTurn("user", "Plan a trip to Lisbon", 1),
                new ConversationTurn("assistant", "Sure, when?", 2),
                new ConversationTurn("user", "In May", 3));

        String summary = summarizer.summarize(turns, 500);

        assertThat(summary).isEqualTo("Conversation history: 3 total messages | User asked about: 2 topics"
                + " | Assistant provided: 1 responses | Initial topic: Plan a trip to Lisbon..."
                + " | Recent topic: In May...");
    }

    @Test
    void summarize_singleUserMessage_omitsRecentTopic() {
        String summary = summarizer.summarize(List.of(new ConversationTurn("user", "Hello", 1)), 500);

        assertThat(summary).contains("Initial topic: Hello...").doesNotContain("Recent topic");
    }

    @Test
    void summarize_longExcerpt_cutAtHundredCharacters() {
        String longText = "a".repeat(150);
        String summary = summarizer.summarize(List.of(new ConversationTurn("user", longText, 1)), 500);

        assertThat(summary).contains("Initial topic: " + "a".repeat(100) + "...");
    }

    @Test
    void summarize_overTarget_truncatedToFourCharsPerToken() {
        List<ConversationTurn> turns = List.of(
                new ConversationTurn("user", "x".repeat(100), 1),
                new ConversationTurn("user", "y".repeat(100), 2));

        String summary = summarizer.summarize(turns, 10);

        assertThat(summary).hasSize(43).endsWith("...");
    }
}
