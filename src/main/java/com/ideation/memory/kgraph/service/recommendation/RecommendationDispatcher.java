package com.ideation.memory.kgraph.service.recommendation;

import com.ideation.memory.kgraph.service.graph.GraphDocumentMutator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Routes a recommendation request to the strategy registered under its method name.
 *
 * Results are restricted to nodes currently in the user's graph. Every failure, an unknown
 * method included, is logged and degrades to an empty list.
 */
@Service
@Slf4j
public class RecommendationDispatcher {

    private final Map<String, RecommendationStrategy> strategies = new TreeMap<>();
    private final GraphDocumentMutator mutator;

    public RecommendationDispatcher(List<RecommendationStrategy> strategies, GraphDocumentMutator mutator) {
        for (RecommendationStrategy strategy : strategies) {
            RecommendationStrategy previous = this.strategies.put(strategy.name(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate recommendation strategy: " + strategy.name());
            }
        }
        this.mutator = mutator;
        log.info("[Recommendation] Registered strategies: {}", this.strategies.keySet());
    }

    Set<String> methods() {
        return Collections.unmodifiableSet(strategies.keySet());
    }

    public List<String> getRecommendations(String userId, String method, Map<String, Object> params) {
        RecommendationStrategy strategy = strategies.get(method);
        if (strategy == null) {
            log.error("[Recommendation] Invalid method: {}. Valid methods are: {} (userId: {})",
                    method, String.join(", ", methods()), userId);
            return Collections.emptyList();
        }

        log.info("[Recommendation] {} requested (userId: {}, params: {})", method, userId, params);
        try {
            List<String> recommended = strategy.recommend(userId, params != null ? params : Map.of());
            if (recommended == null || recommended.isEmpty()) {
                return Collections.emptyList();
            }

            Set<String> existing = mutator.getOrCreate(userId).nodeIds();
            List<String> filtered = recommended.stream()
                    .filter(Objects::nonNull)
                    .filter(existing::contains)
                    .distinct()
                    .toList();

            log.info("[Recommendation] {} returned {}/{} ids present in graph (userId: {})",
                    method, filtered.size(), recommended.size(), userId);
            return filtered;
        } catch (RuntimeException e) {
            log.error("[Recommendation] {} failed (userId: {}): {}", method, userId, e.getMessage(), e);
            return Collections.emptyList();
        }
    }
}
