package com.ideation.memory.kgraph.service.graph;

import com.ideation.memory.kgraph.dto.embedding.EdgeEmbedding;
import com.ideation.memory.kgraph.dto.embedding.NodeEmbedding;
import com.ideation.memory.kgraph.dto.graph.EdgeResponse;
import com.ideation.memory.kgraph.dto.graph.NodeResponse;
import com.ideation.memory.kgraph.model.GraphEdge;
import com.ideation.memory.kgraph.model.GraphNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conversions between embedded graph elements, API views and peer payloads.
 */
public final class GraphMapper {

    private GraphMapper() {
    }

    /**
     * Null becomes empty, null entries are dropped, order is kept. Always returns a mutable copy.
     */
    public static List<String> normalizeLabels(List<String> labels) {
        List<String> normalized = new ArrayList<>();
        if (labels != null) {
            labels.stream().filter(Objects::nonNull).forEach(normalized::add);
        }
        return normalized;
    }

    public static NodeResponse toResponse(GraphNode node) {
        return NodeResponse.builder()
                .id(node.getId())
                .content(node.getContent())
                .label(new ArrayList<>(node.getLabel()))
                .x(node.getX())
                .y(node.getY())
                .sourceMessageId(node.getSourceMessageId())
                .sourceConversationId(node.getSourceConversationId())
                .createdAt(node.getCreatedAt())
                .updatedAt(node.getUpdatedAt())
                .build();
    }

    public static EdgeResponse toResponse(GraphEdge edge) {
        return EdgeResponse.builder()
                .id(edge.getId())
                .source(edge.getSource())
                .target(edge.getTarget())
                .label(new ArrayList<>(edge.getLabel()))
                .createdAt(edge.getCreatedAt())
                .updatedAt(edge.getUpdatedAt())
                .build();
    }

    public static NodeEmbedding toEmbedding(NodeResponse node) {
        return NodeEmbedding.builder()
                .id(node.getId())
                .content(node.getContent())
                .build();
    }

    public static EdgeEmbedding toEmbedding(EdgeResponse edge) {
        return EdgeEmbedding.builder()
                .id(edge.getId())
                .sourceId(edge.getSource())
                .targetId(edge.getTarget())
                .label(String.join(", ", edge.getLabel()))
                .build();
    }
}
