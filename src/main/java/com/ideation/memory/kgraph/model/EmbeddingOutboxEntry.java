package com.ideation.memory.kgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * MongoDB document for a propagation that has not reached the embedding peer yet.
 * Entries are replayed oldest first, per user, by the outbox scheduler.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "embedding_outbox")
@CompoundIndex(name = "outbox_user_status_idx", def = "{'userId': 1, 'status': 1, 'createdAt': 1}")
public class EmbeddingOutboxEntry {

    @Id
    private String id;

    private String userId;

    private IndexCommand command;

    private String status;          // PENDING, FAILED

    private int attempts;

    private String lastError;

    private LocalDateTime createdAt;

    private LocalDateTime lastAttemptAt;

    public static class Status {
        public static final String PENDING = "PENDING";
        public static final String FAILED = "FAILED";
    }
}
