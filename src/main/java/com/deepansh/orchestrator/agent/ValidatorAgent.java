package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.core.Finding;
import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.core.Stage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Sanity-checks the executor's output. No collaborator calls.
 *
 * Checks, first failure wins: findings present, every tool call ok, and at
 * least one of the prompt's first five words appearing in the finding text.
 * When several checks fail, the earliest one is reported, so an empty result
 * reads as "No findings" rather than as an irrelevance complaint.
 * The first failure grants the single retry (retryCount 0 to 1).
 */
@Component
@Slf4j
public class ValidatorAgent extends AbstractStageAgent {

    static final String PASSED = "Executor output validated successfully.";
    static final String NO_FINDINGS = "No findings returned by executor";
    static final String NOT_RELEVANT = "Findings may not be relevant to the request";

    public ValidatorAgent(Clock clock) {
        super(clock);
    }

    @Override
    public Stage stage() {
        return Stage.VALIDATOR;
    }

    @Override
    protected RequestState run(RequestState state) {
        String failure = firstFailure(state);
        boolean passed = failure == null;

        int retryCount = state.getRetryCount();
        if (!passed && retryCount == 0) {
            retryCount = 1;
        }

        if (passed) {
            log.info("[sessionId={}] Validation passed", state.getSessionId());
        } else {
            log.info("[sessionId={}] Validation failed [reason={}, retryCount={}]",
                    state.getSessionId(), failure, retryCount);
        }

        return state.toBuilder()
                .validationPassed(passed)
                .validationFeedback(passed ? PASSED : failure)
                .retryCount(retryCount)
                .build();
    }

    static String firstFailure(RequestState state) {
        if (state.getFindings().isEmpty()) {
            return NO_FINDINGS;
        }

        long failedCalls = state.failedToolCallCount();
        if (failedCalls > 0) {
            return "Tool calls failed: " + failedCalls + " failures detected";
        }

        String findingsText = state.getFindings().stream()
                .map(Finding::result)
                .collect(Collectors.joining(" "));
        if (AgentHeuristics.relevanceOverlap(state.getUserPrompt(), findingsText) == 0) {
            return NOT_RELEVANT;
        }
        return null;
    }
}
