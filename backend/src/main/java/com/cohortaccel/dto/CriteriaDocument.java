package com.cohortaccel.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Wire shape of a structured criteria document, as produced by the text
 * interpretation service. Numeric fields that may be a scalar or a
 * two-element range are kept as {@link JsonNode}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CriteriaDocument(
    @JsonProperty("study_id")
    String studyId,

    String version,

    Integer revision,

    /** Keyed by role; the {@code index_event} entry names the index anchor. */
    Map<String, AnchorDocument> anchors,

    List<PredicateDocument> inclusion,

    List<PredicateDocument> exclusion,

    @JsonProperty("assumptions_and_gaps")
    List<GapDocument> assumptionsAndGaps,

    @JsonProperty("non_rwd_gates")
    List<String> nonRwdGates,

    List<String> assumptions
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnchorDocument(
        String name,
        String description,
        @JsonProperty("derivation_logic")
        String derivationLogic,
        String kind,
        @JsonProperty("predicate_id")
        String predicateId,
        @JsonProperty("fixed_date")
        String fixedDate
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PredicateDocument(
        String id,
        String description,
        String domain,
        String concept,
        @JsonProperty("concept_resolution")
        ConceptResolutionDocument conceptResolution,
        TemporalDocument temporal,
        @JsonProperty("value_constraint")
        ValueConstraintDocument valueConstraint,
        @JsonProperty("count_constraint")
        CountConstraintDocument countConstraint,
        String verifiability,
        @JsonProperty("needs_definition")
        Boolean needsDefinition,
        @JsonProperty("candidate_definitions")
        List<String> candidateDefinitions
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConceptResolutionDocument(
        boolean resolved,
        @JsonProperty("concept_ids")
        List<String> conceptIds,
        @JsonProperty("code_system")
        String codeSystem,
        @JsonProperty("matching_logic")
        String matchingLogic,
        String confidence,
        List<AlternativeDocument> alternatives,
        String notes
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AlternativeDocument(
        @JsonProperty("concept_ids")
        List<String> conceptIds,
        @JsonProperty("code_system")
        String codeSystem,
        @JsonProperty("matching_logic")
        String matchingLogic,
        String description,
        List<String> pros,
        List<String> cons,
        String confidence
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TemporalDocument(
        String reference,
        @JsonProperty("before_days")
        Integer beforeDays,
        @JsonProperty("after_days")
        Integer afterDays,
        String during
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValueConstraintDocument(
        String operator,
        JsonNode value,
        String unit
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CountConstraintDocument(
        String operator,
        JsonNode count,
        @JsonProperty("within_days")
        Integer withinDays,
        Double proportion
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GapDocument(
        @JsonProperty("predicate_id")
        String predicateId,
        String kind,
        String issue,
        @JsonProperty("proposed_resolution")
        String proposedResolution,
        @JsonProperty("requires_user_input")
        boolean requiresUserInput
    ) {}
}
