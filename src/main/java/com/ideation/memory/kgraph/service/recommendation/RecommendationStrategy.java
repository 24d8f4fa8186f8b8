package com.ideation.memory.kgraph.service.recommendation;

import java.util.List;
import java.util.Map;

/**
 * A named way of suggesting nodes to connect.
 * Implementations may return ids that are no longer in the graph; the dispatcher filters them.
 */
public interface RecommendationStrategy {

    /**
     * Registry key, e.g. {@code least_similar}.
     */
    String name();

    List<String> recommend(String userId, Map<String, Object> params);

    static int topK(Map<String, Object> params, int defaultValue) {
        Object raw = params.get("top_k");
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
