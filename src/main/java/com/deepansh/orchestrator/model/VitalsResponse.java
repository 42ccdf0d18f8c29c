package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VitalsResponse {

    private long uptimeSeconds;
    private long totalSessions;
    private long totalMessages;
    private long totalToolCalls;
    private double avgResponseTimeMs;
}
