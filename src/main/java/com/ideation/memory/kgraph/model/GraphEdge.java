package com.ideation.memory.kgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Directed, labeled relation between two nodes of the same {@link GraphDocument}.
 * The label sequence behaves as an insertion-ordered set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {

    @Id
    private String id;

    private String source;      // Source node id
    private String target;      // Target node id

    @Builder.Default
    private List<String> label = new ArrayList<>();

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean connects(String source, String target) {
        return Objects.equals(this.source, source) && Objects.equals(this.target, target);
    }

    /**
     * Append labels that are not present yet, keeping first-seen order.
     *
     * @return true if at least one label was added
     */
    public boolean mergeLabels(List<String> labels) {
        boolean changed = false;
        for (String l : labels) {
            if (!label.contains(l)) {
                label.add(l);
                changed = true;
            }
        }
        return changed;
    }
}
