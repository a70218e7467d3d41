package com.cohortaccel.model.criteria;

import com.cohortaccel.model.enums.GapKind;
import com.cohortaccel.model.enums.Polarity;
import com.cohortaccel.model.enums.Verifiability;
import lombok.Builder;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Ordered collection of predicates with their anchor rules and known gaps.
 * <p>
 * The single source of truth of a cohort session: every pipeline decision
 * (what still needs resolution, what is skipped, what compiles) is derived by
 * reading this document. Instances are immutable; edits produce a new revision.
 */
@Builder(toBuilder = true)
public record CriteriaSet(
    String studyId,
    String version,
    int revision,
    List<Predicate> predicates,
    List<AnchorRule> anchorRules,
    String indexAnchor,
    List<Gap> gaps,
    List<String> assumptions
) {
    /** Temporal references that always mean "the index anchor". */
    public static final Set<String> INDEX_REFERENCES = Set.of("index_date", "index_event", "index");

    public CriteriaSet {
        if (studyId == null || studyId.isBlank()) {
            throw new IllegalArgumentException("Criteria set requires a study id");
        }
        if (version == null || version.isBlank()) {
            version = "1.0";
        }
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
        anchorRules = anchorRules == null ? List.of() : List.copyOf(anchorRules);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);

        Set<String> seen = new HashSet<>();
        for (Predicate predicate : predicates) {
            if (!seen.add(predicate.id())) {
                throw new IllegalArgumentException("Duplicate predicate id: " + predicate.id());
            }
        }
        Set<String> anchorNames = new HashSet<>();
        for (AnchorRule rule : anchorRules) {
            if (!anchorNames.add(rule.name())) {
                throw new IllegalArgumentException("Duplicate anchor rule: " + rule.name());
            }
            if (rule.predicateId() != null && !seen.contains(rule.predicateId())) {
                throw new IllegalArgumentException(
                    "Anchor '" + rule.name() + "' references unknown predicate " + rule.predicateId());
            }
        }
        if (indexAnchor != null && !anchorNames.contains(indexAnchor)) {
            throw new IllegalArgumentException("Index anchor is not a declared anchor rule: " + indexAnchor);
        }
        if (indexAnchor == null && !anchorRules.isEmpty()) {
            indexAnchor = anchorRules.get(0).name();
        }
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    public Optional<Predicate> predicate(String id) {
        return predicates.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    public List<Predicate> inclusions() {
        return predicates.stream().filter(Predicate::isInclusion).toList();
    }

    public List<Predicate> exclusions() {
        return predicates.stream().filter(p -> p.polarity() == Polarity.EXCLUSION).toList();
    }

    public Set<String> predicateIds() {
        return predicates.stream().map(Predicate::id).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Resolve a temporal reference to an anchor rule. The index aliases map to
     * the designated index anchor.
     */
    public Optional<AnchorRule> anchor(String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        String name = INDEX_REFERENCES.contains(reference.toLowerCase(Locale.ROOT)) && indexAnchor != null
            ? indexAnchor : reference;
        return anchorRules.stream().filter(a -> a.name().equalsIgnoreCase(name)).findFirst();
    }

    public Optional<AnchorRule> indexAnchorRule() {
        return indexAnchor == null ? Optional.empty() : anchor(indexAnchor);
    }

    public List<Gap> gapsFor(String predicateId) {
        return gaps.stream().filter(g -> g.predicateId().equals(predicateId)).toList();
    }

    /**
     * True when a recorded gap takes the predicate out of compilation
     * (unresolved-and-skipped, timed out, demoted, awaiting a definition).
     */
    public boolean isSkipped(String predicateId) {
        return gaps.stream()
            .anyMatch(g -> g.predicateId().equals(predicateId) && g.kind().skipsCompilation());
    }

    /**
     * Predicates that still need a concept resolution before the query can be compiled.
     */
    public List<Predicate> pendingConceptResolutions() {
        return predicates.stream()
            .filter(Predicate::requiresConceptResolution)
            .filter(p -> !p.isResolved())
            .filter(p -> !isSkipped(p.id()))
            .toList();
    }

    // ========================================================================
    // Revisions
    // ========================================================================

    public CriteriaSet withPredicate(String predicateId, UnaryOperator<Predicate> edit) {
        Predicate current = predicate(predicateId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown predicate: " + predicateId));
        Predicate edited = edit.apply(current);
        if (!edited.id().equals(predicateId)) {
            throw new IllegalArgumentException("Predicate ids are stable across revisions: " + predicateId);
        }
        List<Predicate> updated = predicates.stream()
            .map(p -> p.id().equals(predicateId) ? edited : p)
            .toList();
        return toBuilder().predicates(updated).build();
    }

    public CriteriaSet withGap(Gap gap) {
        List<Gap> updated = new ArrayList<>(gaps);
        updated.removeIf(g -> g.predicateId().equals(gap.predicateId()) && g.kind() == gap.kind());
        updated.add(gap);
        return toBuilder().gaps(updated).build();
    }

    public CriteriaSet withoutGaps(String predicateId, Set<GapKind> kinds) {
        List<Gap> updated = gaps.stream()
            .filter(g -> !(g.predicateId().equals(predicateId) && kinds.contains(g.kind())))
            .toList();
        return toBuilder().gaps(updated).build();
    }

    /**
     * Attach a resolution and clear the skip markers a previous failed
     * resolution left behind.
     */
    public CriteriaSet withResolution(String predicateId, ConceptResolution resolution) {
        return withPredicate(predicateId, p -> p.toBuilder().conceptResolution(resolution).build())
            .withoutGaps(predicateId, EnumSet.of(GapKind.UNRESOLVED_CONCEPT, GapKind.RESOLUTION_TIMEOUT));
    }

    /**
     * Demote a predicate to documentation-only and record why.
     */
    public CriteriaSet demote(String predicateId, GapKind kind, String issue, String proposedResolution) {
        return withPredicate(predicateId, p -> p.toBuilder().verifiability(Verifiability.NON_RWD).build())
            .withGap(new Gap(predicateId, kind, issue, proposedResolution, true));
    }

    public CriteriaSet nextRevision() {
        return toBuilder().revision(revision + 1).build();
    }
}
