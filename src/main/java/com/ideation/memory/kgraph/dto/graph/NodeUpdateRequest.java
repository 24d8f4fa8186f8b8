package com.ideation.memory.kgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial node update: a null field means "leave unchanged".
 * {@code labels} is an alias of {@code label} and wins when both are sent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeUpdateRequest {

    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> label;

    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> labels;

    private Double x;

    private Double y;

    private String content;

    @JsonProperty("source_message_id")
    private String sourceMessageId;

    @JsonProperty("source_conversation_id")
    private String sourceConversationId;
}
