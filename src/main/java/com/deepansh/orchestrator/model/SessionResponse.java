package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String sessionId;
    private String userId;
    private String summary;

    /** Chat turns started, including ones that failed or were cancelled */
    private int turnCount;

    /** Persisted user and assistant messages */
    private long messageCount;

    private Instant createdAt;
    private Instant updatedAt;
}
