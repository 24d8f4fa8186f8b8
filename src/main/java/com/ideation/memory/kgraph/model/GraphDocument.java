package com.ideation.memory.kgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB document holding one user's whole knowledge graph.
 * Nodes and edges are embedded sub-documents addressed by their own ids,
 * so every mutation of the graph is a single-document write.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "kgraphs")
public class GraphDocument {

    @Id
    private String id;

    @Indexed(unique = true)
    private String userId;

    // Optimistic concurrency token, bumped on every save
    @Version
    private Long version;

    @Builder.Default
    private List<GraphNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<GraphEdge> edges = new ArrayList<>();

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static GraphDocument empty(String userId) {
        LocalDateTime now = LocalDateTime.now();
        return GraphDocument.builder()
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Optional<GraphNode> findNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return nodes.stream()
                .filter(node -> nodeId.equals(node.getId()))
                .findFirst();
    }

    /**
     * Edges are unique per ordered (source, target) pair.
     */
    public Optional<GraphEdge> findEdge(String source, String target) {
        return edges.stream()
                .filter(edge -> edge.connects(source, target))
                .findFirst();
    }

    public Set<String> nodeIds() {
        Set<String> ids = new HashSet<>();
        for (GraphNode node : nodes) {
            ids.add(node.getId());
        }
        return ids;
    }

    /**
     * Remove the given nodes together with every edge touching one of them.
     *
     * @return ids of the edges removed by the cascade
     */
    public List<String> removeNodesCascading(Collection<String> nodeIds) {
        Set<String> doomed = new HashSet<>(nodeIds);
        nodes.removeIf(node -> doomed.contains(node.getId()));

        List<String> removedEdgeIds = new ArrayList<>();
        edges.removeIf(edge -> {
            boolean incident = doomed.contains(edge.getSource()) || doomed.contains(edge.getTarget());
            if (incident) {
                removedEdgeIds.add(edge.getId());
            }
            return incident;
        });
        return removedEdgeIds;
    }

    /**
     * Refresh updatedAt on whichever endpoints of a (source, target) pair exist.
     *
     * @return the endpoint nodes that were found, source first
     */
    public List<GraphNode> touchEndpoints(String source, String target, LocalDateTime now) {
        List<GraphNode> touched = new ArrayList<>();
        findNode(source).ifPresent(touched::add);
        findNode(target).ifPresent(touched::add);
        touched.forEach(node -> node.setUpdatedAt(now));
        return touched;
    }
}
