package com.ideation.memory.kgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeResponse {

    private String id;
    private String content;
    private List<String> label;
    private double x;
    private double y;

    @JsonProperty("source_message_id")
    private String sourceMessageId;

    @JsonProperty("source_conversation_id")
    private String sourceConversationId;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
