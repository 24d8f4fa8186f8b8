package com.ideation.memory.kgraph.service.recommendation;

import com.ideation.memory.kgraph.model.GraphNode;
import com.ideation.memory.kgraph.service.graph.GraphDocumentMutator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Least recently touched nodes first, to resurface forgotten ideas.
 */
@Component
@RequiredArgsConstructor
public class OldestNodesStrategy implements RecommendationStrategy {

    private static final int DEFAULT_TOP_K = 5;

    private final GraphDocumentMutator mutator;

    @Override
    public String name() {
        return "old_ones";
    }

    @Override
    public List<String> recommend(String userId, Map<String, Object> params) {
        int topK = RecommendationStrategy.topK(params, DEFAULT_TOP_K);

        return mutator.getOrCreate(userId).getNodes().stream()
                .sorted(Comparator.comparing(OldestNodesStrategy::lastTouched,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(Math.max(topK, 0))
                .map(GraphNode::getId)
                .toList();
    }

    private static LocalDateTime lastTouched(GraphNode node) {
        return node.getUpdatedAt() != null ? node.getUpdatedAt() : node.getCreatedAt();
    }
}
