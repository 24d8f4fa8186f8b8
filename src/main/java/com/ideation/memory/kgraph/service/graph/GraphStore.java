package com.ideation.memory.kgraph.service.graph;

import com.ideation.memory.kgraph.dto.graph.DeleteEdgeResponse;
import com.ideation.memory.kgraph.dto.graph.DeleteNodesResponse;
import com.ideation.memory.kgraph.dto.graph.EdgeMutationResponse;
import com.ideation.memory.kgraph.dto.graph.EdgeRequest;
import com.ideation.memory.kgraph.dto.graph.EdgeResponse;
import com.ideation.memory.kgraph.dto.graph.GraphResponse;
import com.ideation.memory.kgraph.dto.graph.NodeCreateRequest;
import com.ideation.memory.kgraph.dto.graph.NodeResponse;
import com.ideation.memory.kgraph.dto.graph.NodeUpdateRequest;
import com.ideation.memory.kgraph.dto.graph.ResetResponse;
import com.ideation.memory.kgraph.exception.GraphElementNotFoundException;
import com.ideation.memory.kgraph.exception.InvalidGraphRequestException;
import com.ideation.memory.kgraph.model.GraphDocument;
import com.ideation.memory.kgraph.model.GraphEdge;
import com.ideation.memory.kgraph.model.GraphNode;
import com.ideation.memory.kgraph.service.embedding.IndexSynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CRUD on the nodes and edges of a user's knowledge graph.
 *
 * Each operation is one committed document write. Changes with semantic content are then handed to
 * the {@link IndexSynchronizer}; a failure there never undoes or fails the committed write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphStore {

    private final GraphDocumentMutator mutator;
    private final IndexSynchronizer indexSynchronizer;

    public GraphDocument getOrCreate(String userId) {
        return mutator.getOrCreate(userId);
    }

    /**
     * Fetch the graph, optionally narrowed to the nodes of one conversation.
     * An edge is kept only when both of its endpoints survive the node filter.
     */
    public GraphResponse getGraph(String userId, String conversationId) {
        GraphDocument graph = mutator.getOrCreate(userId);

        List<GraphNode> nodes = conversationId == null
                ? graph.getNodes()
                : graph.getNodes().stream()
                        .filter(node -> conversationId.equals(node.getSourceConversationId()))
                        .toList();

        Set<String> nodeIds = nodes.stream().map(GraphNode::getId).collect(Collectors.toSet());
        List<GraphEdge> edges = conversationId == null
                ? graph.getEdges()
                : graph.getEdges().stream()
                        .filter(edge -> nodeIds.contains(edge.getSource()) && nodeIds.contains(edge.getTarget()))
                        .toList();

        return GraphResponse.builder()
                .nodes(nodes.stream().map(GraphMapper::toResponse).toList())
                .edges(edges.stream().map(GraphMapper::toResponse).toList())
                .build();
    }

    public NodeResponse createNode(String userId, NodeCreateRequest request, String authorization) {
        NodeResponse created = mutator.mutate(userId, graph -> {
            LocalDateTime now = LocalDateTime.now();
            GraphNode node = GraphNode.builder()
                    .id(GraphNode.newId())
                    .content(request.getContent() != null ? request.getContent() : "")
                    .label(GraphMapper.normalizeLabels(request.getLabel()))
                    .x(request.getX() != null ? request.getX() : 0)
                    .y(request.getY() != null ? request.getY() : 0)
                    .sourceMessageId(request.getSourceMessageId())
                    .sourceConversationId(request.getSourceConversationId())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            graph.getNodes().add(node);
            return GraphMapper.toResponse(node);
        });
        log.info("[KGraph] Created node {} (userId: {})", created.getId(), userId);

        indexSynchronizer.embedNodes(userId, List.of(GraphMapper.toEmbedding(created)), authorization);
        return created;
    }

    /**
     * Apply only the supplied fields. The node is re-embedded only if its content changed.
     */
    public NodeResponse updateNode(String userId, String nodeId, NodeUpdateRequest request, String authorization) {
        NodeUpdate update = mutator.mutate(userId, graph -> {
            GraphNode node = graph.findNode(nodeId)
                    .orElseThrow(() -> new GraphElementNotFoundException("Node not found: " + nodeId));

            if (request.getLabels() != null) {
                node.setLabel(GraphMapper.normalizeLabels(request.getLabels()));
            } else if (request.getLabel() != null) {
                node.setLabel(GraphMapper.normalizeLabels(request.getLabel()));
            }
            if (request.getX() != null) {
                node.setX(request.getX());
            }
            if (request.getY() != null) {
                node.setY(request.getY());
            }

            boolean contentChanged = false;
            if (request.getContent() != null) {
                contentChanged = !request.getContent().equals(node.getContent());
                node.setContent(request.getContent());
            }
            if (request.getSourceMessageId() != null) {
                node.setSourceMessageId(request.getSourceMessageId());
            }
            if (request.getSourceConversationId() != null) {
                node.setSourceConversationId(request.getSourceConversationId());
            }
            node.setUpdatedAt(LocalDateTime.now());

            return new NodeUpdate(GraphMapper.toResponse(node), contentChanged);
        });
        log.info("[KGraph] Updated node {} (userId: {}, contentChanged: {})", nodeId, userId, update.contentChanged());

        if (update.contentChanged()) {
            indexSynchronizer.embedNodes(userId, List.of(GraphMapper.toEmbedding(update.node())), authorization);
        }
        return update.node();
    }

    /**
     * Remove the nodes and every incident edge in one write, then drop their vectors.
     * Ids that do not resolve are ignored.
     *
     * @return the number of ids requested
     */
    public DeleteNodesResponse deleteNodes(String userId, List<String> nodeIds, String authorization) {
        if (nodeIds == null || nodeIds.isEmpty()) {
            throw new InvalidGraphRequestException("nodeIds must not be empty");
        }

        List<String> removedEdgeIds = mutator.mutate(userId, graph -> graph.removeNodesCascading(nodeIds));
        log.info("[KGraph] Deleted nodes {} and {} incident edges (userId: {})",
                nodeIds, removedEdgeIds.size(), userId);

        List<String> vectorIds = new ArrayList<>(nodeIds);
        vectorIds.addAll(removedEdgeIds);
        indexSynchronizer.delete(userId, vectorIds, authorization);

        return DeleteNodesResponse.builder().deletedNodes(nodeIds.size()).build();
    }

    /**
     * Connect source to target. An existing edge for the pair gets the new labels merged in
     * (duplicates skipped) instead of a second edge being created.
     */
    public EdgeMutationResponse createEdge(String userId, EdgeRequest request, String authorization) {
        String source = request.getSource();
        String target = request.getTarget();
        List<String> labels = GraphMapper.normalizeLabels(request.getLabel());

        EdgeMutationResponse result = mutator.mutate(userId, graph -> {
            LocalDateTime now = LocalDateTime.now();
            GraphEdge edge = graph.findEdge(source, target).orElse(null);

            if (edge != null) {
                edge.mergeLabels(labels);
                edge.setUpdatedAt(now);
            } else {
                edge = GraphEdge.builder()
                        .id(GraphNode.newId())
                        .source(source)
                        .target(target)
                        .label(dedupe(labels))
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                graph.getEdges().add(edge);
            }

            List<GraphNode> endpoints = graph.touchEndpoints(source, target, now);
            return toEdgeMutation(edge, endpoints);
        });
        log.info("[KGraph] Connected {} -> {} as edge {} with labels {} (userId: {})",
                source, target, result.getEdge().getId(), result.getEdge().getLabel(), userId);

        indexSynchronizer.embedEdges(userId, List.of(GraphMapper.toEmbedding(result.getEdge())), authorization);
        return result;
    }

    /**
     * Replace the label sequence of an existing edge. No label clears it.
     */
    public EdgeMutationResponse updateEdge(String userId, EdgeRequest request, String authorization) {
        String source = request.getSource();
        String target = request.getTarget();
        List<String> labels = GraphMapper.normalizeLabels(request.getLabel());

        EdgeMutationResponse result = mutator.mutate(userId, graph -> {
            GraphEdge edge = graph.findEdge(source, target)
                    .orElseThrow(() -> new GraphElementNotFoundException(
                            "Edge not found: " + source + " -> " + target));

            LocalDateTime now = LocalDateTime.now();
            edge.setLabel(labels);
            edge.setUpdatedAt(now);

            List<GraphNode> endpoints = graph.touchEndpoints(source, target, now);
            return toEdgeMutation(edge, endpoints);
        });
        log.info("[KGraph] Relabeled edge {} to {} (userId: {})",
                result.getEdge().getId(), result.getEdge().getLabel(), userId);

        indexSynchronizer.embedEdges(userId, List.of(GraphMapper.toEmbedding(result.getEdge())), authorization);
        return result;
    }

    public DeleteEdgeResponse deleteEdge(String userId, EdgeRequest request, String authorization) {
        String source = request.getSource();
        String target = request.getTarget();

        String edgeId = mutator.mutate(userId, graph -> {
            GraphEdge edge = graph.findEdge(source, target)
                    .orElseThrow(() -> new GraphElementNotFoundException(
                            "Edge not found: " + source + " -> " + target));

            graph.touchEndpoints(source, target, LocalDateTime.now());
            graph.getEdges().remove(edge);
            return edge.getId();
        });
        log.info("[KGraph] Deleted edge {} ({} -> {}, userId: {})", edgeId, source, target, userId);

        indexSynchronizer.delete(userId, List.of(edgeId), authorization);
        return DeleteEdgeResponse.builder().deletedCount(1).build();
    }

    /**
     * Delete the whole graph, then reset the user's vectors. A failed reset is only logged;
     * the document deletion stands.
     */
    public ResetResponse clearGraph(String userId, String authorization) {
        boolean existed = mutator.delete(userId);
        log.info("[KGraph] Graph deleted (userId: {}, existed: {})", userId, existed);

        if (!indexSynchronizer.reset(userId, authorization)) {
            log.warn("[KGraph] Vector reset for user {} deferred, index may still hold old vectors", userId);
        }
        return ResetResponse.builder().success(true).build();
    }

    private static EdgeMutationResponse toEdgeMutation(GraphEdge edge, List<GraphNode> endpoints) {
        List<NodeResponse> nodes = endpoints.stream().map(GraphMapper::toResponse).toList();
        EdgeResponse edgeResponse = GraphMapper.toResponse(edge);
        return EdgeMutationResponse.builder()
                .edge(edgeResponse)
                .nodes(nodes)
                .build();
    }

    private static List<String> dedupe(List<String> labels) {
        List<String> unique = new ArrayList<>();
        labels.stream().filter(Objects::nonNull).filter(l -> !unique.contains(l)).forEach(unique::add);
        return unique;
    }

    private record NodeUpdate(NodeResponse node, boolean contentChanged) {}
}
