package com.deepansh.orchestrator.stream;

/**
 * Latency figures carried by the done event and persisted with the answer.
 * All instants are epoch milliseconds.
 *
 * @param ttftMs null when no token was emitted
 */
public record DoneTimings(long requestStart,
                          Long firstTokenAt,
                          long completedAt,
                          Long ttftMs,
                          long totalMs) {
}
