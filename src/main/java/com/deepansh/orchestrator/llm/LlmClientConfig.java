package com.deepansh.orchestrator.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Chooses the raw completion client from {@code llm.provider}.
 *
 * "mock" (the default) needs no key and answers deterministically, which is
 * what lets the whole pipeline run offline. Any provider name without a
 * matching {@code llm.providers} entry falls back to mock with a warning.
 * The chosen client is wrapped by {@link com.deepansh.orchestrator.resilience.ResilientLlmClient}.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(LlmProperties properties,
                                     @Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        if (LlmProperties.MOCK.equalsIgnoreCase(properties.getProvider())) {
            log.info("LLM provider: mock (deterministic, offline)");
            return new MockLlmClient();
        }

        LlmProperties.Provider active = properties.activeProvider();
        if (active == null) {
            log.warn("No llm.providers entry for '{}', known: {}. Using the mock client",
                    properties.getProvider(), properties.getProviders().keySet());
            return new MockLlmClient();
        }

        if (active.hasApiKey()) {
            log.info("LLM provider: {} [model={}, key={}]", active.getName(), active.getModel(), active.maskedKey());
        } else {
            log.error("LLM provider {} has no API key; set {}_API_KEY. Planner and composer will use fallbacks",
                    active.getName(), active.getName().toUpperCase());
        }
        return new GenericLlmClient(active, builder.clone());
    }
}
