package com.ideation.memory.kgraph.model;

import com.ideation.memory.kgraph.dto.embedding.EdgeEmbedding;
import com.ideation.memory.kgraph.dto.embedding.NodeEmbedding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A single propagation to the embedding peer. Only the payload list matching
 * {@link #operation} is populated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexCommand {

    private String userId;

    private IndexOperation operation;

    @Builder.Default
    private List<NodeEmbedding> nodes = new ArrayList<>();

    @Builder.Default
    private List<EdgeEmbedding> edges = new ArrayList<>();

    @Builder.Default
    private List<String> ids = new ArrayList<>();

    public static IndexCommand embedNodes(String userId, List<NodeEmbedding> nodes) {
        return IndexCommand.builder()
                .userId(userId)
                .operation(IndexOperation.EMBED_NODES)
                .nodes(new ArrayList<>(nodes))
                .build();
    }

    public static IndexCommand embedEdges(String userId, List<EdgeEmbedding> edges) {
        return IndexCommand.builder()
                .userId(userId)
                .operation(IndexOperation.EMBED_EDGES)
                .edges(new ArrayList<>(edges))
                .build();
    }

    public static IndexCommand delete(String userId, List<String> ids) {
        return IndexCommand.builder()
                .userId(userId)
                .operation(IndexOperation.DELETE)
                .ids(new ArrayList<>(ids))
                .build();
    }

    public static IndexCommand reset(String userId) {
        return IndexCommand.builder()
                .userId(userId)
                .operation(IndexOperation.RESET)
                .build();
    }

    public int size() {
        return switch (operation) {
            case EMBED_NODES -> nodes.size();
            case EMBED_EDGES -> edges.size();
            case DELETE -> ids.size();
            case RESET -> 1;
        };
    }
}
