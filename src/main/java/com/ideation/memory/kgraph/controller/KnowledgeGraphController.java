package com.ideation.memory.kgraph.controller;

import com.ideation.memory.kgraph.dto.embedding.ClusterPoint;
import com.ideation.memory.kgraph.dto.graph.DeleteEdgeResponse;
import com.ideation.memory.kgraph.dto.graph.DeleteNodesResponse;
import com.ideation.memory.kgraph.dto.graph.EdgeMutationResponse;
import com.ideation.memory.kgraph.dto.graph.EdgeRequest;
import com.ideation.memory.kgraph.dto.graph.GraphResponse;
import com.ideation.memory.kgraph.dto.graph.NodeCreateRequest;
import com.ideation.memory.kgraph.dto.graph.NodeIdsRequest;
import com.ideation.memory.kgraph.dto.graph.NodeResponse;
import com.ideation.memory.kgraph.dto.graph.NodeUpdateRequest;
import com.ideation.memory.kgraph.dto.graph.ResetResponse;
import com.ideation.memory.kgraph.service.cluster.ClusterCoordinator;
import com.ideation.memory.kgraph.service.graph.GraphStore;
import com.ideation.memory.kgraph.service.importer.ImportCoordinator;
import com.ideation.memory.kgraph.service.recommendation.RecommendationDispatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the caller's knowledge graph.
 * The caller is identified by the X-User-Id header; the Authorization header, when present,
 * is forwarded to the embedding service.
 */
@RestController
@RequestMapping("/api/kgraph")
@RequiredArgsConstructor
@Slf4j
public class KnowledgeGraphController {

    static final String USER_HEADER = "X-User-Id";

    private final GraphStore graphStore;
    private final ImportCoordinator importCoordinator;
    private final ClusterCoordinator clusterCoordinator;
    private final RecommendationDispatcher recommendationDispatcher;

    /**
     * Get the graph, or only the part built from one conversation.
     */
    @GetMapping
    public ResponseEntity<GraphResponse> getGraph(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(required = false) String conversationId) {
        log.info("Getting graph for user: {}, conversation: {}", userId, conversationId);
        return ResponseEntity.ok(graphStore.getGraph(userId, conversationId));
    }

    @PostMapping("/nodes")
    public ResponseEntity<NodeResponse> createNode(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody NodeCreateRequest request) {
        NodeResponse node = graphStore.createNode(userId, request, authorization);
        return ResponseEntity.status(HttpStatus.CREATED).body(node);
    }

    @PatchMapping("/nodes/{nodeId}")
    public ResponseEntity<NodeResponse> updateNode(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String nodeId,
            @RequestBody NodeUpdateRequest request) {
        return ResponseEntity.ok(graphStore.updateNode(userId, nodeId, request, authorization));
    }

    /**
     * Import scratch nodes attached to chat messages.
     */
    @PostMapping("/nodes/batch")
    public ResponseEntity<List<NodeResponse>> importNodes(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody NodeIdsRequest request) {
        log.info("Importing {} candidate nodes for user: {}", request.getNodeIds().size(), userId);
        List<NodeResponse> nodes = importCoordinator.importNodes(userId, request.getNodeIds(), authorization);
        return ResponseEntity.status(HttpStatus.CREATED).body(nodes);
    }

    @PostMapping("/nodes/delete")
    public ResponseEntity<DeleteNodesResponse> deleteNodes(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody NodeIdsRequest request) {
        return ResponseEntity.ok(graphStore.deleteNodes(userId, request.getNodeIds(), authorization));
    }

    @PostMapping("/edges")
    public ResponseEntity<EdgeMutationResponse> createEdge(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody EdgeRequest request) {
        return ResponseEntity.ok(graphStore.createEdge(userId, request, authorization));
    }

    /**
     * Replace the labels of an existing edge.
     */
    @PatchMapping("/edges")
    public ResponseEntity<EdgeMutationResponse> updateEdge(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody EdgeRequest request) {
        return ResponseEntity.ok(graphStore.updateEdge(userId, request, authorization));
    }

    @DeleteMapping("/edges")
    public ResponseEntity<DeleteEdgeResponse> deleteEdge(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody EdgeRequest request) {
        return ResponseEntity.ok(graphStore.deleteEdge(userId, request, authorization));
    }

    /**
     * Recompute node positions from the embedding service's projection.
     * Returns the normalized coordinates; fetch the graph again for display coordinates.
     */
    @PostMapping("/cluster")
    public ResponseEntity<List<ClusterPoint>> calculateCluster(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return ResponseEntity.ok(clusterCoordinator.calculateCluster(userId, authorization));
    }

    /**
     * Node recommendations by method; all other query parameters go to the strategy.
     */
    @GetMapping("/recommendations")
    public ResponseEntity<List<String>> getRecommendations(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam String method,
            @RequestParam Map<String, String> allParams) {
        Map<String, Object> params = new HashMap<>(allParams);
        params.remove("method");
        return ResponseEntity.ok(recommendationDispatcher.getRecommendations(userId, method, params));
    }

    /**
     * Delete the whole graph and its vectors.
     */
    @DeleteMapping
    public ResponseEntity<ResetResponse> clearGraph(
            @RequestHeader(USER_HEADER) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        log.info("Clearing graph for user: {}", userId);
        return ResponseEntity.ok(graphStore.clearGraph(userId, authorization));
    }
}
