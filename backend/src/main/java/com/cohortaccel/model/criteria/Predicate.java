package com.cohortaccel.model.criteria;

import com.cohortaccel.model.enums.ClinicalDomain;
import com.cohortaccel.model.enums.Polarity;
import com.cohortaccel.model.enums.Verifiability;
import lombok.Builder;

import java.util.List;

/**
 * One inclusion or exclusion rule. The id stays stable across revisions.
 */
@Builder(toBuilder = true)
public record Predicate(
    String id,
    String description,
    Polarity polarity,
    ClinicalDomain domain,
    String concept,
    ConceptResolution conceptResolution,
    TemporalWindow temporalWindow,
    ValueConstraint valueConstraint,
    CountConstraint countConstraint,
    Verifiability verifiability,
    boolean needsDefinition,
    List<String> candidateDefinitions
) {
    public Predicate {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Predicate requires an id");
        }
        if (polarity == null) {
            throw new IllegalArgumentException("Predicate " + id + " requires a polarity");
        }
        if (domain == null) {
            throw new IllegalArgumentException("Predicate " + id + " requires a domain");
        }
        if (verifiability == null) {
            verifiability = Verifiability.RWD;
        }
        if (concept == null || concept.isBlank()) {
            concept = description != null ? description : id;
        }
        if (description == null) {
            description = concept;
        }
        candidateDefinitions = candidateDefinitions == null ? List.of() : List.copyOf(candidateDefinitions);
    }

    public boolean isInclusion() {
        return polarity == Polarity.INCLUSION;
    }

    public boolean isResolved() {
        return conceptResolution != null && conceptResolution.resolved();
    }

    /**
     * Code-based predicates that are meant to be queried must carry a resolved
     * concept before they can be compiled.
     */
    public boolean requiresConceptResolution() {
        return domain.isCodeBased() && verifiability.isQueryable();
    }

    public String label() {
        return id + ": " + (description != null ? description : concept);
    }
}
