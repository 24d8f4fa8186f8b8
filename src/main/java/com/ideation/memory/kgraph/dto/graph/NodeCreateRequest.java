package com.ideation.memory.kgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeCreateRequest {

    // A single string is accepted and wrapped
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> label;

    private Double x;

    private Double y;

    private String content;

    @JsonProperty("source_message_id")
    private String sourceMessageId;

    @JsonProperty("source_conversation_id")
    private String sourceConversationId;
}
