package com.ideation.memory.kgraph.service.recommendation;

import com.ideation.memory.kgraph.service.embedding.EmbeddingPeerClient;
import org.springframework.stereotype.Component;

/**
 * Node pairs related the same way an existing edge relates its endpoints.
 */
@Component
public class EdgeAnalogyStrategy extends PeerRecommendationStrategy {

    public EdgeAnalogyStrategy(EmbeddingPeerClient peerClient) {
        super(peerClient);
    }

    @Override
    public String name() {
        return "edge_analogy";
    }
}
