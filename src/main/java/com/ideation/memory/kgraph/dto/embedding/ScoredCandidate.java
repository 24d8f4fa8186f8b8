package com.ideation.memory.kgraph.dto.embedding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredCandidate {

    private String id;
    private Double score;       // null when the peer could not score the candidate
}
