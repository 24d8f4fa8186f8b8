package com.ideation.memory.kgraph.dto.graph;

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
public class EdgeResponse {

    private String id;
    private String source;
    private String target;
    private List<String> label;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
