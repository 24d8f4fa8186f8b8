package com.ideation.memory.kgraph.service.recommendation;

import com.ideation.memory.kgraph.exception.InvalidGraphRequestException;
import com.ideation.memory.kgraph.model.GraphNode;
import com.ideation.memory.kgraph.service.graph.GraphDocumentMutator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Nodes carrying the requested label ({@code tag}), compared case-insensitively.
 */
@Component
@RequiredArgsConstructor
public class NodeTagStrategy implements RecommendationStrategy {

    private final GraphDocumentMutator mutator;

    @Override
    public String name() {
        return "node_tag";
    }

    @Override
    public List<String> recommend(String userId, Map<String, Object> params) {
        Object tag = params.get("tag");
        if (tag == null || tag.toString().isBlank()) {
            throw new InvalidGraphRequestException("tag is required for node_tag recommendation");
        }
        String wanted = tag.toString().trim();
        int topK = RecommendationStrategy.topK(params, Integer.MAX_VALUE);

        return mutator.getOrCreate(userId).getNodes().stream()
                .filter(node -> node.getLabel().stream().anyMatch(wanted::equalsIgnoreCase))
                .limit(Math.max(topK, 0))
                .map(GraphNode::getId)
                .toList();
    }
}
