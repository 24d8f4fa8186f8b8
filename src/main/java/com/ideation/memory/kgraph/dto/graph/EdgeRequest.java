package com.ideation.memory.kgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Edge addressed by its (source, target) pair. The label is ignored on delete.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeRequest {

    @NotBlank(message = "source is required")
    private String source;

    @NotBlank(message = "target is required")
    private String target;

    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> label;
}
