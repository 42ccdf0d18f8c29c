package com.deepansh.orchestrator.core;

/**
 * One pipeline stage: takes the current request state and returns the next one.
 * Implementations must not mutate their input.
 */
public interface StageAgent {

    Stage stage();

    RequestState apply(RequestState state);
}
