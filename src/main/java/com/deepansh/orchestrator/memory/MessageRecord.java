package com.deepansh.orchestrator.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One conversation message.
 *
 * Collection: messages. The executor's db.find reads this collection
 * directly by sessionId, so the field names are part of the query contract.
 */
@Document(collection = "messages")
@CompoundIndex(name = "idx_session_ts", def = "{'sessionId': 1, 'timestamp': 1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRecord {

    @Id
    private String id;

    private String sessionId;
    private String userId;

    /** user | assistant */
    private String role;

    private String content;

    /** Assistant messages: suggestions, timings, ttftMs, totalMs */
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;

    /** Epoch millis; ordering key for history reads */
    private long timestamp;

    public ConversationTurn toTurn() {
        return new ConversationTurn(role, content, timestamp);
    }
}
