package com.ideation.memory.kgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteNodesResponse {

    private int deletedNodes;       // number of ids requested, not number found
}
