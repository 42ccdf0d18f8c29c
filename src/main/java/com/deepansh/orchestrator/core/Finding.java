package com.deepansh.orchestrator.core;

import java.util.List;
import java.util.Map;

/**
 * Result of executing one subtask (or the synthetic retry marker).
 *
 * @param kind   what produced this finding
 * @param task   the subtask text, or {@code retry_adjustment} for the retry marker
 * @param result human-readable outcome; the validator scores relevance against this text
 * @param data   documents retrieved for RETRIEVED findings, otherwise empty or a marker entry
 */
public record Finding(Kind kind, String task, String result, List<Map<String, Object>> data) {

    public enum Kind { RETRIEVED, FAILED, COMPLETED, RETRY }

    public static final String RETRY_TASK = "retry_adjustment";

    public Finding {
        data = data != null ? List.copyOf(data) : List.of();
    }

    public static Finding retrieved(String task, int count, List<Map<String, Object>> data) {
        return new Finding(Kind.RETRIEVED, task,
                "Retrieved " + count + " messages from conversation history", data);
    }

    public static Finding failed(String task, String reason) {
        return new Finding(Kind.FAILED, task, "Error fetching data: " + reason, List.of());
    }

    public static Finding completed(String task) {
        return new Finding(Kind.COMPLETED, task, "Completed: " + task, List.of());
    }

    public static Finding retryMarker(int attempt) {
        return new Finding(Kind.RETRY, RETRY_TASK, "Re-executed tasks with improved strategy",
                List.of(Map.of("retryAttempt", attempt)));
    }
}
