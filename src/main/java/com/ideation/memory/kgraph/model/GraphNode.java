package com.ideation.memory.kgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A content unit of the knowledge graph, embedded in its owner's {@link GraphDocument}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    @Id
    private String id;              // ObjectId hex, assigned once at creation

    @Builder.Default
    private String content = "";

    @Builder.Default
    private List<String> label = new ArrayList<>();

    @Builder.Default
    private double x = 0;

    @Builder.Default
    private double y = 0;

    @Field("source_message_id")
    private String sourceMessageId;

    @Field("source_conversation_id")
    private String sourceConversationId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static String newId() {
        return new ObjectId().toHexString();
    }
}
