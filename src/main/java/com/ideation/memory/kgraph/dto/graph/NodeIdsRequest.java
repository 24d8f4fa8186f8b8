package com.ideation.memory.kgraph.dto.graph;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeIdsRequest {

    @NotEmpty(message = "nodeIds must not be empty")
    private List<String> nodeIds;
}
