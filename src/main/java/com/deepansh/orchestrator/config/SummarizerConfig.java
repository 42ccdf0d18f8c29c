package com.deepansh.orchestrator.config;

import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.memory.HeuristicSummarizer;
import com.deepansh.orchestrator.memory.LlmSummarizer;
import com.deepansh.orchestrator.memory.Summarizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the summarization strategy from orchestrator.context.summarizer.
 */
@Configuration
@Slf4j
public class SummarizerConfig {

    @Bean
    public Summarizer summarizer(OrchestratorProperties properties, LlmClient llmClient) {
        String strategy = properties.getContext().getSummarizer();
        HeuristicSummarizer heuristic = new HeuristicSummarizer();

        if ("llm".equalsIgnoreCase(strategy)) {
            log.info("Summarizer: llm (heuristic fallback)");
            return new LlmSummarizer(llmClient, heuristic);
        }
        if (!"heuristic".equalsIgnoreCase(strategy)) {
            log.warn("Unknown summarizer '{}', using heuristic", strategy);
        }
        log.info("Summarizer: heuristic");
        return heuristic;
    }
}
