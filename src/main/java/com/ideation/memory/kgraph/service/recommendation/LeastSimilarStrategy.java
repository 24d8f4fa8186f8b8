package com.ideation.memory.kgraph.service.recommendation;

import com.ideation.memory.kgraph.service.embedding.EmbeddingPeerClient;
import org.springframework.stereotype.Component;

/**
 * Nodes whose embeddings are furthest from the given node ({@code nodeId}, {@code top_k}).
 */
@Component
public class LeastSimilarStrategy extends PeerRecommendationStrategy {

    public LeastSimilarStrategy(EmbeddingPeerClient peerClient) {
        super(peerClient);
    }

    @Override
    public String name() {
        return "least_similar";
    }
}
