package com.ideation.memory.kgraph.service.recommendation;

import com.ideation.memory.kgraph.dto.embedding.ScoredCandidate;
import com.ideation.memory.kgraph.service.embedding.EmbeddingPeerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Strategy computed by the embedding peer over the user's vectors.
 * Parameters are forwarded untouched; scores are logged and dropped.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class PeerRecommendationStrategy implements RecommendationStrategy {

    private final EmbeddingPeerClient peerClient;

    @Override
    public List<String> recommend(String userId, Map<String, Object> params) {
        List<ScoredCandidate> candidates = peerClient.recommend(userId, name(), params);
        if (log.isDebugEnabled()) {
            candidates.stream().limit(3).forEach(c ->
                    log.debug("[Recommendation] {} candidate {} score={}", name(), c.getId(), c.getScore()));
        }
        return candidates.stream()
                .map(ScoredCandidate::getId)
                .filter(Objects::nonNull)
                .toList();
    }
}
