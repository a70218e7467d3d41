package com.cohortaccel.service.pipeline;

import com.cohortaccel.model.enums.PipelineStage;

import java.util.List;

/**
 * A stage that could not complete, with the exact classification and the
 * predicates that caused it.
 */
public record StageFailure(
    PipelineStage stage,
    String classification,
    List<String> predicateIds,
    String message
) {
    public StageFailure {
        predicateIds = predicateIds == null ? List.of() : List.copyOf(predicateIds);
    }
}
