package com.deepansh.orchestrator.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Session metadata and the running summary used by the context packer.
 *
 * Collection: sessions, keyed by sessionId.
 */
@Document(collection = "sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    @Id
    private String sessionId;

    @Indexed
    private String userId;

    /** Long-term summary; rewritten when packed context exceeds the token budget */
    private String summary;

    @Builder.Default
    private int turnCount = 0;

    private Instant createdAt;

    private Instant updatedAt;
}
