package com.cohortaccel.model.plan;

import com.cohortaccel.model.criteria.Gap;

import java.util.*;

/**
 * Immutable compiled cohort query.
 * <p>
 * Combination rule: {@code final = (base ∩ inclusions...) − (∪ exclusions...)}.
 * The three query texts are rendered once at compile time and are the durable,
 * auditable artifacts for this version. A repair produces a new version whose
 * {@code parentVersion} points here.
 */
public record QueryPlan(
    String studyId,
    int criteriaRevision,
    int version,
    Integer parentVersion,
    String basePopulationBody,
    List<AnchorExpression> anchors,
    String indexAnchorCte,
    List<QueryFragment> fragments,
    List<String> inclusionIds,
    List<String> exclusionIds,
    List<Gap> gaps,
    List<String> assumptions,
    String cohortSql,
    String countSql,
    String funnelSql
) {
    public static final String BASE_CTE = "BASE_POPULATION";

    public QueryPlan {
        anchors = anchors == null ? List.of() : List.copyOf(anchors);
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        inclusionIds = inclusionIds == null ? List.of() : List.copyOf(inclusionIds);
        exclusionIds = exclusionIds == null ? List.of() : List.copyOf(exclusionIds);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
    }

    /**
     * Identity of this plan version within its session; cache entries are keyed by it.
     */
    public String planId() {
        return studyId + "@r" + criteriaRevision + "v" + version;
    }

    public Optional<QueryFragment> fragment(String predicateId) {
        return fragments.stream().filter(f -> f.predicateId().equals(predicateId)).findFirst();
    }

    public Set<String> fragmentIds() {
        Set<String> ids = new LinkedHashSet<>();
        fragments.forEach(f -> ids.add(f.predicateId()));
        return ids;
    }

    public Optional<AnchorExpression> anchor(String cteName) {
        return anchors.stream().filter(a -> a.cteName().equals(cteName)).findFirst();
    }
}
