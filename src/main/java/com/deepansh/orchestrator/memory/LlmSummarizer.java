package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.llm.LlmClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Asks the text generator for the summary. Any failure or blank reply falls
 * back to {@link HeuristicSummarizer}.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmSummarizer implements Summarizer {

    private static final double TEMPERATURE = 0.3;

    private final LlmClient llmClient;
    private final HeuristicSummarizer fallback;

    @Override
    public String summarize(List<ConversationTurn> turns, int targetTokens) {
        String transcript = turns.stream()
                .map(ConversationTurn::formatLine)
                .collect(Collectors.joining("\n"));

        String prompt = """
                Summarize the following conversation in at most %d tokens.
                Keep names, facts the user stated about themselves, and open questions.

                %s
                """.formatted(targetTokens, transcript);

        try {
            String summary = llmClient.generate(prompt, targetTokens, TEMPERATURE);
            if (summary == null || summary.isBlank()) {
                log.warn("Summarizer returned blank output, using heuristic summary");
                return fallback.summarize(turns, targetTokens);
            }
            return Summarizer.truncate(summary.strip(), targetTokens);
        } catch (Exception e) {
            log.warn("LLM summarization failed, using heuristic summary: {}", e.getMessage());
            return fallback.summarize(turns, targetTokens);
        }
    }
}
