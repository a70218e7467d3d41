package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of a cohort session.
 *
 * <pre>
 * collecting_criteria -> compiling_concepts -> compiling_query -> executing
 *   executing -> repairing -> executing (bounded)
 *   executing -> funneling -> awaiting_feedback
 *   awaiting_feedback -> revising -> compiling_concepts | compiling_query
 *   awaiting_feedback -> finalized
 * </pre>
 */
public enum PipelineStage {
    COLLECTING_CRITERIA("collecting_criteria"),
    COMPILING_CONCEPTS("compiling_concepts"),
    COMPILING_QUERY("compiling_query"),
    EXECUTING("executing"),
    REPAIRING("repairing"),
    FUNNELING("funneling"),
    AWAITING_FEEDBACK("awaiting_feedback"),
    REVISING("revising"),
    FINALIZED("finalized");

    private final String value;

    PipelineStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<PipelineStage> successors() {
        return switch (this) {
            case COLLECTING_CRITERIA -> EnumSet.of(COMPILING_CONCEPTS);
            case COMPILING_CONCEPTS -> EnumSet.of(COMPILING_QUERY);
            case COMPILING_QUERY -> EnumSet.of(EXECUTING, AWAITING_FEEDBACK);
            case EXECUTING -> EnumSet.of(REPAIRING, FUNNELING, AWAITING_FEEDBACK);
            case REPAIRING -> EnumSet.of(EXECUTING, AWAITING_FEEDBACK);
            case FUNNELING -> EnumSet.of(AWAITING_FEEDBACK);
            case AWAITING_FEEDBACK -> EnumSet.of(REVISING, FINALIZED);
            case REVISING -> EnumSet.of(COMPILING_CONCEPTS, COMPILING_QUERY);
            case FINALIZED -> EnumSet.noneOf(PipelineStage.class);
        };
    }

    public boolean canTransitionTo(PipelineStage next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == FINALIZED;
    }
}
