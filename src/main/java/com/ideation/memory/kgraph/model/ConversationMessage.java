package com.ideation.memory.kgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat message owned by the messaging subsystem. Only the fields needed to
 * promote its scratch nodes into the knowledge graph are mapped here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "messages")
public class ConversationMessage {

    @Id
    private String id;

    @Indexed
    private String messageId;

    private String conversationId;

    @Field("user")
    private String userId;

    @Builder.Default
    private List<CandidateNode> nodes = new ArrayList<>();
}
