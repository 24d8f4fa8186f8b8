package com.ideation.memory.kgraph.dto.embedding;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Minimal edge payload for {@code embed/edge}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeEmbedding {

    private String id;

    @JsonProperty("source_id")
    private String sourceId;

    @JsonProperty("target_id")
    private String targetId;

    private String label;       // edge labels joined with ", "
}
