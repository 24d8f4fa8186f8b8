package com.ideation.memory.kgraph.service.recommendation;

import com.ideation.memory.kgraph.service.embedding.EmbeddingPeerClient;
import org.springframework.stereotype.Component;

/**
 * Nodes semantically closest to the given node ({@code nodeId}, {@code top_k}).
 */
@Component
public class SynonymsStrategy extends PeerRecommendationStrategy {

    public SynonymsStrategy(EmbeddingPeerClient peerClient) {
        super(peerClient);
    }

    @Override
    public String name() {
        return "synonyms";
    }
}
