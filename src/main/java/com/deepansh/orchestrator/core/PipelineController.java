package com.deepansh.orchestrator.core;

import lombok.extern.slf4j.Slf4j;

/**
 * State machine driving the four stages.
 *
 * <pre>
 *   PLANNING -> EXECUTING -> VALIDATING -> COMPOSING -> DONE
 *                   ^             |
 *                   +-------------+  once, when validation fails with no retry granted yet
 * </pre>
 *
 * The executor and validator therefore run at most twice each, and always
 * the same number of times. After the single retry the validation outcome
 * no longer affects control flow: the request always proceeds to the composer.
 */
@Slf4j
public class PipelineController {

    private final StageAgent planner;
    private final StageAgent executor;
    private final StageAgent validator;
    private final StageAgent composer;

    public PipelineController(StageAgent planner,
                              StageAgent executor,
                              StageAgent validator,
                              StageAgent composer) {
        this.planner = requireStage(planner, Stage.PLANNER);
        this.executor = requireStage(executor, Stage.EXECUTOR);
        this.validator = requireStage(validator, Stage.VALIDATOR);
        this.composer = requireStage(composer, Stage.COMPOSER);
    }

    public RequestState run(RequestState initial, StageObserver observer) {
        RequestState state = initial;
        PipelineState phase = PipelineState.PLANNING;

        while (phase != PipelineState.DONE) {
            switch (phase) {
                case PLANNING -> {
                    state = step(planner, state, observer);
                    phase = PipelineState.EXECUTING;
                }
                case EXECUTING -> {
                    state = step(executor, state, observer);
                    phase = PipelineState.VALIDATING;
                }
                case VALIDATING -> {
                    int retriesGranted = state.getRetryCount();
                    state = step(validator, state, observer);
                    if (!state.isValidationPassed() && retriesGranted == 0) {
                        log.info("[sessionId={}] Validation failed, retrying executor: {}",
                                state.getSessionId(), state.getValidationFeedback());
                        phase = PipelineState.EXECUTING;
                    } else {
                        if (!state.isValidationPassed()) {
                            log.warn("[sessionId={}] Validation failed after retry, composing anyway: {}",
                                    state.getSessionId(), state.getValidationFeedback());
                        }
                        phase = PipelineState.COMPOSING;
                    }
                }
                case COMPOSING -> {
                    state = step(composer, state, observer);
                    phase = PipelineState.DONE;
                }
                default -> throw new IllegalStateException("Unexpected pipeline state: " + phase);
            }
        }

        log.info("[sessionId={}] Pipeline done [retries={}, timings={}]",
                state.getSessionId(), state.getRetryCount(), state.getTimings());
        return state;
    }

    private RequestState step(StageAgent agent, RequestState state, StageObserver observer) {
        log.debug("[sessionId={}] Running stage {}", state.getSessionId(), agent.stage().wireName());
        RequestState next = agent.apply(state);
        observer.onStageCompleted(agent.stage(), state, next);
        return next;
    }

    private static StageAgent requireStage(StageAgent agent, Stage expected) {
        if (agent == null || agent.stage() != expected) {
            throw new IllegalArgumentException("Expected a " + expected.wireName() + " agent, got "
                    + (agent == null ? "null" : agent.stage().wireName()));
        }
        return agent;
    }
}
