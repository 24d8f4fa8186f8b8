package com.ideation.memory.kgraph.service.cluster;

import com.ideation.memory.kgraph.dto.embedding.ClusterPoint;
import com.ideation.memory.kgraph.model.GraphNode;
import com.ideation.memory.kgraph.service.embedding.EmbeddingPeerClient;
import com.ideation.memory.kgraph.service.graph.GraphDocumentMutator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Recomputes the 2-D layout of a user's graph from the peer's UMAP projection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClusterCoordinator {

    // Peer coordinates are normalized; the graph view works in this many display units
    static final double DISPLAY_SCALE = 250;

    private final EmbeddingPeerClient peerClient;
    private final GraphDocumentMutator mutator;

    /**
     * Ask the peer for a layout and store the scaled coordinates on the matching nodes.
     * Ids the graph does not know are skipped. Peer failures propagate to the caller.
     *
     * @return the peer's points, unscaled
     */
    public List<ClusterPoint> calculateCluster(String userId, String authorization) {
        log.info("[Cluster] Requesting layout (userId: {})", userId);
        List<ClusterPoint> points = peerClient.calculateLayout(userId, authorization);

        int applied = mutator.mutate(userId, graph -> {
            int count = 0;
            for (ClusterPoint point : points) {
                Optional<GraphNode> node = graph.findNode(point.getId());
                if (node.isPresent()) {
                    node.get().setX(point.getX() * DISPLAY_SCALE);
                    node.get().setY(point.getY() * DISPLAY_SCALE);
                    count++;
                } else {
                    log.warn("[Cluster] Node not found in graph (userId: {}, nodeId: {})", userId, point.getId());
                }
            }
            return count;
        });

        log.info("[Cluster] Layout applied to {}/{} nodes (userId: {})", applied, points.size(), userId);
        return points;
    }
}
