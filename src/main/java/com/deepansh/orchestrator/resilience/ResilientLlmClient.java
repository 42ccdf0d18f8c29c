package com.deepansh.orchestrator.resilience;

import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * The {@link LlmClient} every stage and the summarizer get injected.
 *
 * Adds the "llmClient" retry and circuit breaker from application.yml around
 * the provider client. Whatever still fails surfaces as {@link AgentException};
 * turning that into fallback text is the caller's job, so a dead provider
 * degrades answers instead of failing the stream.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private static final String INSTANCE = "llmClient";

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = INSTANCE, fallbackMethod = "unavailable")
    @CircuitBreaker(name = INSTANCE)
    public String generate(String prompt, int maxTokens, double temperature) {
        long start = System.currentTimeMillis();
        String text = delegate.generate(prompt, maxTokens, temperature);
        log.debug("Completion in {}ms [promptChars={}, replyChars={}]",
                System.currentTimeMillis() - start, prompt.length(), text != null ? text.length() : 0);
        return text;
    }

    public String unavailable(String prompt, int maxTokens, double temperature, Throwable ex) {
        if (ex instanceof AgentException ae) {
            throw ae;
        }
        if (ex instanceof CallNotPermittedException) {
            log.warn("Completion rejected, circuit '{}' is open", INSTANCE);
            throw new AgentException("Model provider unavailable (circuit open)", ex);
        }
        log.error("Completion failed after retries: {}", ex.getMessage());
        throw new AgentException("Model provider unavailable: " + ex.getMessage(), ex);
    }
}
