package com.deepansh.orchestrator.llm;

/**
 * Text-generation collaborator used by the planner, the composer and the
 * LLM-backed summarizer.
 */
public interface LlmClient {

    /**
     * Single-shot completion.
     *
     * @param prompt      full prompt text
     * @param maxTokens   completion token cap
     * @param temperature sampling temperature
     * @return generated text, never null (may be blank)
     */
    String generate(String prompt, int maxTokens, double temperature);
}
