package com.deepansh.orchestrator.core;

/**
 * Notified by {@link PipelineController} after every stage.
 *
 * An exception thrown from the callback aborts the run; the event relay
 * uses this to stop a pipeline whose client has gone away.
 */
@FunctionalInterface
public interface StageObserver {

    StageObserver NONE = (stage, previous, current) -> { };

    void onStageCompleted(Stage stage, RequestState previous, RequestState current);
}
