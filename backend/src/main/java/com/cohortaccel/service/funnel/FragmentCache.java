package com.cohortaccel.service.funnel;

import com.cohortaccel.model.plan.QueryFragment;
import com.cohortaccel.model.plan.QueryPlan;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Session-scoped cache of compiled fragments and combination counts.
 * <p>
 * Fragments are write-once per predicate id for one plan version and safe to
 * share across concurrent what-if recomputations. Entries are keyed by plan id,
 * so a count loaded for a plan that was replaced mid-flight is never served for
 * its successor. Binding a different plan version clears everything. Never
 * shared between sessions.
 */
public class FragmentCache {

    private final Map<String, QueryFragment> fragments = new ConcurrentHashMap<>();
    private final Map<String, Long> counts = new ConcurrentHashMap<>();
    private volatile String planId;

    public synchronized void bind(QueryPlan plan) {
        if (!plan.planId().equals(planId)) {
            fragments.clear();
            counts.clear();
            planId = plan.planId();
        }
        plan.fragments().forEach(f -> fragments.putIfAbsent(scoped(plan, f.predicateId()), f));
    }

    public String planId() {
        return planId;
    }

    /**
     * Fragment of the given plan; read from the plan itself once the cache moved on.
     */
    public Optional<QueryFragment> fragment(QueryPlan plan, String predicateId) {
        QueryFragment cached = fragments.get(scoped(plan, predicateId));
        return cached != null ? Optional.of(cached) : plan.fragment(predicateId);
    }

    /**
     * Memoized count for a combination key of the given plan; concurrent callers
     * may both compute, the first stored value wins. Nothing is stored when the
     * cache was bound to another plan while loading.
     */
    public long count(QueryPlan plan, String key, LongSupplier loader) {
        String scopedKey = scoped(plan, key);
        Long cached = counts.get(scopedKey);
        if (cached != null) {
            return cached;
        }
        long value = loader.getAsLong();
        synchronized (this) {
            if (!plan.planId().equals(planId)) {
                return value;
            }
            Long previous = counts.putIfAbsent(scopedKey, value);
            return previous != null ? previous : value;
        }
    }

    public int cachedCountSize() {
        return counts.size();
    }

    private static String scoped(QueryPlan plan, String key) {
        return plan.planId() + "#" + key;
    }
}
