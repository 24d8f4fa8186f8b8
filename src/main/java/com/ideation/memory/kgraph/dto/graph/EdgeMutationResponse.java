package com.ideation.memory.kgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The edge after a create/update, plus its endpoint nodes with their refreshed updatedAt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeMutationResponse {

    private EdgeResponse edge;
    private List<NodeResponse> nodes;
}
