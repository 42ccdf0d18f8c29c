package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsResponse {

    private String sessionId;
    private long totalRequests;

    /** Null when no request in the session streamed a token */
    private Double avgTtftMs;
    private double avgTotalMs;
    private long totalToolCalls;
}
