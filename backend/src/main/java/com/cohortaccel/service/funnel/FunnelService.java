package com.cohortaccel.service.funnel;

import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.enums.FunnelWarningKind;
import com.cohortaccel.model.funnel.FunnelReport;
import com.cohortaccel.model.funnel.FunnelStep;
import com.cohortaccel.model.funnel.FunnelWarning;
import com.cohortaccel.model.plan.QueryFragment;
import com.cohortaccel.model.plan.QueryPlan;
import com.cohortaccel.service.compiler.QueryCompilerService;
import com.cohortaccel.service.execution.QueryExecutionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Funnel Engine
 *
 * Stepwise attrition over an enabled subset of a plan's fragments:
 * - base population
 * - one cumulative step per enabled inclusion, in declared order
 * - one final subtractive step for all enabled exclusions
 *
 * Counts run over cached fragments, only the combination SQL is rebuilt, and
 * each combination is counted at most once per plan version.
 */
@Slf4j
@Service
public class FunnelService {

    private final QueryCompilerService compiler;
    private final QueryExecutionService executionService;
    private final CohortProperties properties;

    public FunnelService(
            QueryCompilerService compiler,
            QueryExecutionService executionService,
            CohortProperties properties) {
        this.compiler = compiler;
        this.executionService = executionService;
        this.properties = properties;
    }

    public FunnelReport computeFunnel(QueryPlan plan, Set<String> enabledPredicateIds) {
        FragmentCache cache = new FragmentCache();
        cache.bind(plan);
        return computeFunnel(plan, enabledPredicateIds, cache);
    }

    /**
     * Ids that are unknown or have no fragment (gaps) are ignored.
     *
     * @throws com.cohortaccel.service.execution.ExecutionException when a step count fails
     */
    public FunnelReport computeFunnel(QueryPlan plan, Set<String> enabledPredicateIds, FragmentCache cache) {
        cache.bind(plan);
        Set<String> enabled = enabledPredicateIds == null ? Set.of() : enabledPredicateIds.stream()
            .filter(id -> cache.fragment(plan, id).isPresent())
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (enabledPredicateIds != null && enabled.size() < enabledPredicateIds.size()) {
            log.debug("Funnel for {} ignores ids without fragments: {}", plan.planId(),
                enabledPredicateIds.stream().filter(id -> !enabled.contains(id)).toList());
        }

        List<QueryFragment> inclusions = plan.inclusionIds().stream()
            .filter(enabled::contains)
            .map(id -> cache.fragment(plan, id).orElseThrow())
            .toList();
        List<QueryFragment> exclusions = plan.exclusionIds().stream()
            .filter(enabled::contains)
            .map(id -> cache.fragment(plan, id).orElseThrow())
            .toList();

        long base = count(plan, cache, List.of(), List.of());
        List<FunnelStep> steps = new ArrayList<>();
        steps.add(step("Base population", FunnelStep.BASE, base, base, base));

        if (!enabled.isEmpty()) {
            long previous = base;
            for (int i = 0; i < inclusions.size(); i++) {
                QueryFragment fragment = inclusions.get(i);
                long stepCount = count(plan, cache, inclusions.subList(0, i + 1), List.of());
                steps.add(step(fragment.description(), fragment.predicateId(), stepCount, base, previous));
                previous = stepCount;
            }
            long finalCount = count(plan, cache, inclusions, exclusions);
            steps.add(step("After exclusions", FunnelStep.FINAL, finalCount, base, previous));
        }

        List<FunnelWarning> warnings = warnings(steps);
        log.info("Funnel for {} over {} enabled predicates: {}", plan.planId(), enabled.size(),
            steps.stream().map(s -> s.predicateId() + "=" + s.count()).collect(Collectors.joining(", ")));
        return new FunnelReport(plan.planId(), enabled, steps, warnings);
    }

    // ========================================================================
    // Counting
    // ========================================================================

    private long count(QueryPlan plan, FragmentCache cache, List<QueryFragment> inclusions, List<QueryFragment> exclusions) {
        String key = "I:" + inclusions.stream().map(QueryFragment::predicateId).collect(Collectors.joining(","))
            + "|E:" + exclusions.stream().map(QueryFragment::predicateId).sorted().collect(Collectors.joining(","));
        return cache.count(plan, key, () -> executionService.count(
            compiler.combinationCountSql(plan, inclusions, exclusions),
            properties.getExecution().getQueryTimeout()));
    }

    // ========================================================================
    // Steps and Warnings
    // ========================================================================

    private FunnelStep step(String label, String predicateId, long count, long base, long previous) {
        long drop = Math.max(0, previous - count);
        return new FunnelStep(label, predicateId, count, percent(count, base), drop, percent(drop, previous));
    }

    /**
     * Percentage with one decimal; 0 when the denominator is 0.
     */
    static double percent(long numerator, long denominator) {
        if (denominator == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(numerator * 100.0 / denominator).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private List<FunnelWarning> warnings(List<FunnelStep> steps) {
        List<FunnelWarning> warnings = new ArrayList<>();
        double threshold = properties.getExecution().getSuspiciousDropThreshold();
        for (int i = 1; i < steps.size(); i++) {
            long previous = steps.get(i - 1).count();
            FunnelStep step = steps.get(i);
            if (previous > 0 && (double) step.dropCount() / previous > threshold) {
                warnings.add(new FunnelWarning(FunnelWarningKind.SUSPICIOUS_DROP, step.predicateId(),
                    String.format("Step '%s' removes %d of %d subjects (%.1f%%)",
                        step.stepLabel(), step.dropCount(), previous, step.dropPercent())));
            }
        }
        warnings.addAll(executionService.cohortFlags(steps.get(steps.size() - 1).count()));
        return warnings;
    }
}
