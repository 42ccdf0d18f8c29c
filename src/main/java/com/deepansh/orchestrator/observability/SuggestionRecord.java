package com.deepansh.orchestrator.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * The three follow-up suggestions attached to an assistant message.
 */
@Document(collection = "suggestions")
@CompoundIndex(name = "idx_session_created", def = "{'sessionId': 1, 'createdAt': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionRecord {

    @Id
    private String id;

    private String sessionId;
    private String userId;

    @Indexed
    private String messageId;

    private List<String> suggestions;

    private Instant createdAt;
}
