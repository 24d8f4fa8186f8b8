package com.ideation.memory.kgraph.service.embedding;

import com.ideation.memory.kgraph.dto.embedding.EdgeEmbedding;
import com.ideation.memory.kgraph.dto.embedding.NodeEmbedding;

import java.util.List;

/**
 * Keeps the external embedding index in line with committed graph changes.
 * Implementations must never throw for a peer failure: the graph change is already durable.
 * Each method returns true when the peer acknowledged the change, false when it was deferred.
 */
public interface IndexSynchronizer {

    boolean embedNodes(String userId, List<NodeEmbedding> nodes, String authorization);

    boolean embedEdges(String userId, List<EdgeEmbedding> edges, String authorization);

    boolean delete(String userId, List<String> ids, String authorization);

    boolean reset(String userId, String authorization);
}
