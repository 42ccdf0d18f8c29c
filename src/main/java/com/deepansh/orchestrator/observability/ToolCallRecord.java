package com.deepansh.orchestrator.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

/**
 * Read model for the tool_calls collection. Rows are written through
 * {@code DatabaseTools.insert} by {@link ConversationRecorder}, using these field names.
 */
@Document(collection = ToolCallRecord.COLLECTION)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRecord {

    public static final String COLLECTION = "tool_calls";

    @Id
    private String id;

    private String sessionId;
    private String userId;
    private String tool;
    private Map<String, Object> args;

    /** ok | error */
    private String status;
    private int count;
    private String error;
    private double latencyMs;
    private long timestamp;
}
