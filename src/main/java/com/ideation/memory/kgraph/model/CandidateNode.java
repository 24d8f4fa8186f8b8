package com.ideation.memory.kgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Scratch node attached to a {@link ConversationMessage}, not yet part of the graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateNode {

    @Id
    private String id;

    private String content;

    private String label;       // single label, unlike graph nodes

    private Double x;

    private Double y;

    @Field("isCurated")
    private boolean curated;    // set once promoted into the graph
}
