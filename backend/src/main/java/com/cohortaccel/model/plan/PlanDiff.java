package com.cohortaccel.model.plan;

import java.util.*;

/**
 * Fragment-level difference between two plan versions, logged with every repair attempt.
 */
public record PlanDiff(
    int fromVersion,
    int toVersion,
    List<String> addedFragments,
    List<String> removedFragments,
    List<String> changedFragments,
    List<String> demotedPredicates
) {
    public PlanDiff {
        addedFragments = List.copyOf(addedFragments);
        removedFragments = List.copyOf(removedFragments);
        changedFragments = List.copyOf(changedFragments);
        demotedPredicates = demotedPredicates == null ? List.of() : List.copyOf(demotedPredicates);
    }

    public static PlanDiff between(QueryPlan previous, QueryPlan next, Collection<String> demoted) {
        Map<String, String> before = new LinkedHashMap<>();
        previous.fragments().forEach(f -> before.put(f.predicateId(), f.body()));
        Map<String, String> after = new LinkedHashMap<>();
        next.fragments().forEach(f -> after.put(f.predicateId(), f.body()));

        List<String> added = after.keySet().stream().filter(id -> !before.containsKey(id)).toList();
        List<String> removed = before.keySet().stream().filter(id -> !after.containsKey(id)).toList();
        List<String> changed = after.keySet().stream()
            .filter(before::containsKey)
            .filter(id -> !Objects.equals(before.get(id), after.get(id)))
            .toList();
        return new PlanDiff(previous.version(), next.version(), added, removed, changed,
            demoted == null ? List.of() : new ArrayList<>(demoted));
    }

    public boolean isEmpty() {
        return addedFragments.isEmpty() && removedFragments.isEmpty()
            && changedFragments.isEmpty() && demotedPredicates.isEmpty();
    }

    public String summary() {
        if (isEmpty()) {
            return "v" + fromVersion + " -> v" + toVersion + ": no fragment changes";
        }
        return String.format("v%d -> v%d: added=%s removed=%s changed=%s demoted=%s",
            fromVersion, toVersion, addedFragments, removedFragments, changedFragments, demotedPredicates);
    }
}
