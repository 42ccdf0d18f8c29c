package com.deepansh.orchestrator.core;

/**
 * Controller states. DONE is terminal.
 */
public enum PipelineState {
    PLANNING,
    EXECUTING,
    VALIDATING,
    COMPOSING,
    DONE
}
