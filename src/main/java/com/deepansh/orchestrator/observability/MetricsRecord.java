package com.deepansh.orchestrator.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

/**
 * Latency and tool usage for one answered turn.
 *
 * Collection: metrics. ttftMs is null when the answer streamed no tokens.
 */
@Document(collection = "metrics")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsRecord {

    @Id
    private String id;

    @Indexed
    private String sessionId;
    private String userId;

    /** Id of the assistant message this turn produced */
    private String messageId;

    private Long ttftMs;
    private long totalMs;
    private int toolCallCount;

    /** Stage name to elapsed ms */
    private Map<String, Long> agentTimings;

    private long timestamp;
}
