package com.deepansh.orchestrator.stream;

import com.deepansh.orchestrator.core.RequestState;

/**
 * Persists a finished turn. Invoked by {@link EventRelay} after the pipeline
 * reaches its terminal state and before the done event; a failure here turns
 * the stream's outcome into an error.
 *
 * A commit that throws must leave nothing behind. A commit that returns hands
 * back a {@link CommittedTurn} the relay rolls back if the client is gone
 * before done could be delivered.
 */
@FunctionalInterface
public interface TurnCommitter {

    CommittedTurn commit(RequestState finalState, DoneTimings timings);

    @FunctionalInterface
    interface CommittedTurn {

        /** Removes every record the commit wrote. */
        void rollback();
    }
}
