package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.llm.LlmClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmSummarizerTest {

    @Mock LlmClient llmClient;

    private final HeuristicSummarizer heuristic = new HeuristicSummarizer();
    private final List<ConversationTurn> turns = List.of(
            new ConversationTurn("user", "My name is Ada.", 1),
            new ConversationTurn("assistant", "Hi Ada!", 2));

    @Test
    void summarize_modelReply_usedAndTranscriptSent() {
        when(llmClient.generate(contains("USER: My name is Ada."), eq(500), anyDouble()))
                .thenReturn("  The user is Ada.  ");

        String summary = new LlmSummarizer(llmClient, heuristic).summarize(turns, 500);

        assertThat(summary).isEqualTo("The user is Ada.");
    }

    @Test
    void summarize_blankReply_fallsBackToHeuristic() {
        when(llmClient.generate(anyString(), anyInt(), anyDouble())).thenReturn("   ");

        String summary = new LlmSummarizer(llmClient, heuristic).summarize(turns, 500);

        assertThat(summary).isEqualTo(heuristic.summarize(turns, 500));
    }

    @Test
    void summarize_modelFailure_fallsBackToHeuristic() {
        when(llmClient.generate(anyString(), anyInt(), anyDouble())).thenThrow(new RuntimeException("503"));

        String summary = new LlmSummarizer(llmClient, heuristic).summarize(turns, 500);

        assertThat(summary).startsWith("Conversation history: 2 total messages");
    }

    @Test
    void summarize_longReply_truncated() {
        when(llmClient.generate(anyString(), anyInt(), anyDouble())).thenReturn("z".repeat(100));

        String summary = new LlmSummarizer(llmClient, heuristic).summarize(turns, 5);

        assertThat(summary).isEqualTo("z".repeat(20) + "...");
    }
}
