package com.ideation.memory.kgraph.dto.embedding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Minimal node payload for {@code embed/node}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeEmbedding {

    private String id;
    private String content;
}
