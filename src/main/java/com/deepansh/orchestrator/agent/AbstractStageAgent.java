package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.core.StageAgent;

import java.time.Clock;

/**
 * Records the wall-clock time of {@link #run} under the stage's name and
 * marks the stage as current.
 */
public abstract class AbstractStageAgent implements StageAgent {

    protected final Clock clock;

    protected AbstractStageAgent(Clock clock) {
        this.clock = clock;
    }

    @Override
    public final RequestState apply(RequestState state) {
        long start = clock.millis();
        RequestState next = run(state);
        return next.withStageTiming(stage(), clock.millis() - start);
    }

    protected abstract RequestState run(RequestState state);
}
