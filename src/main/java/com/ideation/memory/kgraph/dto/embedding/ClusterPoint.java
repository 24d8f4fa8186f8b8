package com.ideation.memory.kgraph.dto.embedding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the {@code calculate-umap} response, in normalized coordinates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterPoint {

    private String id;
    private double x;
    private double y;
}
