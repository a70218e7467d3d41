package com.cohortaccel.model.plan;

import com.cohortaccel.model.enums.Polarity;

import java.util.List;
import java.util.Set;

/**
 * Compiled, named sub-query implementing one predicate. The body selects
 * distinct {@code subject_id} values; {@code anchorDependencies} lists the
 * anchor CTEs the body joins to.
 */
public record QueryFragment(
    String predicateId,
    String cteName,
    Polarity polarity,
    String description,
    String logicSummary,
    String body,
    List<String> anchorDependencies,
    Set<String> referencedTables,
    Set<String> referencedColumns
) {
    public QueryFragment {
        anchorDependencies = anchorDependencies == null ? List.of() : List.copyOf(anchorDependencies);
        referencedTables = referencedTables == null ? Set.of() : Set.copyOf(referencedTables);
        referencedColumns = referencedColumns == null ? Set.of() : Set.copyOf(referencedColumns);
    }
}
