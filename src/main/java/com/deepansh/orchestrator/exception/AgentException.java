package com.deepansh.orchestrator.exception;

/**
 * Non-retryable failure talking to a collaborator (bad API key, malformed
 * provider response, open circuit). Listed in the resilience4j ignore lists,
 * so it neither triggers a retry nor counts as a circuit-breaker failure.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
