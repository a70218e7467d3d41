package com.cohortaccel.service.execution;

import com.cohortaccel.catalog.CatalogAdapter;
import com.cohortaccel.catalog.CatalogSchema;
import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.criteria.CriteriaSet;
import com.cohortaccel.model.enums.ExecutionErrorKind;
import com.cohortaccel.model.enums.GapKind;
import com.cohortaccel.model.execution.ExecutionResult;
import com.cohortaccel.model.execution.RepairAttempt;
import com.cohortaccel.model.plan.PlanDiff;
import com.cohortaccel.model.plan.QueryFragment;
import com.cohortaccel.model.plan.QueryPlan;
import com.cohortaccel.service.compiler.CompileException;
import com.cohortaccel.service.compiler.QueryCompilerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * One step of the bounded repair loop.
 * <p>
 * Refreshes the catalog, localizes the failing fragments by counting each one
 * on its own, demotes fragments whose tables or columns the refreshed catalog
 * no longer has, and recompiles into the next plan version. The attempt bound
 * is enforced by the caller.
 */
@Slf4j
@Service
public class PlanRepairService {

    private final CatalogAdapter catalogAdapter;
    private final QueryCompilerService compiler;
    private final QueryExecutionService executionService;
    private final CohortProperties properties;

    public PlanRepairService(
            CatalogAdapter catalogAdapter,
            QueryCompilerService compiler,
            QueryExecutionService executionService,
            CohortProperties properties) {
        this.catalogAdapter = catalogAdapter;
        this.compiler = compiler;
        this.executionService = executionService;
        this.properties = properties;
    }

    public record RepairOutcome(
        CriteriaSet criteriaSet,
        CatalogSchema catalog,
        QueryPlan plan,
        RepairAttempt attempt
    ) {}

    /**
     * @throws CompileException when the repaired criteria no longer compile
     */
    public RepairOutcome repair(CriteriaSet criteriaSet, QueryPlan plan, ExecutionResult failure, int attempt) {
        if (failure.isOk() || failure.errorKind() == null || !failure.errorKind().isRepairable()) {
            throw new IllegalArgumentException("Only repairable execution failures can be repaired");
        }
        CatalogSchema catalog = catalogAdapter.getSchema();

        List<String> failing = localize(plan, catalog, failure.errorKind());
        CriteriaSet repaired = criteriaSet;
        List<String> demoted = new ArrayList<>();
        for (String predicateId : failing) {
            QueryFragment fragment = plan.fragment(predicateId).orElseThrow();
            List<String> missing = missingReferences(fragment, catalog);
            if (!missing.isEmpty()) {
                repaired = repaired.demote(predicateId, GapKind.MISSING_CATALOG_DATA,
                    "Data store lacks " + String.join(", ", missing),
                    "Supply a manual resolution against available data or accept as a non_rwd gap");
                demoted.add(predicateId);
            }
        }
        if (!demoted.isEmpty()) {
            repaired = repaired.nextRevision();
        }

        QueryPlan next = compiler.compile(repaired, catalog, plan);
        PlanDiff diff = PlanDiff.between(plan, next, demoted);
        log.warn("Repair attempt {} for {} after {}: failing={} {}", attempt, plan.planId(),
            failure.errorKind().getValue(), failing, diff.summary());

        return new RepairOutcome(repaired, catalog, next,
            new RepairAttempt(attempt, failure.errorKind(), failure.errorMessage(), failing, diff));
    }

    /**
     * Fragments that reference data missing from the catalog, or that fail
     * when counted on their own. Timeouts skip the per-fragment counts.
     */
    private List<String> localize(QueryPlan plan, CatalogSchema catalog, ExecutionErrorKind kind) {
        Set<String> failing = new LinkedHashSet<>();
        for (QueryFragment fragment : plan.fragments()) {
            if (!missingReferences(fragment, catalog).isEmpty()) {
                failing.add(fragment.predicateId());
                continue;
            }
            if (kind == ExecutionErrorKind.TIMEOUT) {
                continue;
            }
            try {
                executionService.count(compiler.fragmentCountSql(plan, fragment),
                    properties.getExecution().getQueryTimeout());
            } catch (ExecutionException e) {
                log.debug("Fragment {} of {} fails on its own: {}", fragment.cteName(), plan.planId(), e.getMessage());
                failing.add(fragment.predicateId());
            }
        }
        return new ArrayList<>(failing);
    }

    private List<String> missingReferences(QueryFragment fragment, CatalogSchema catalog) {
        List<String> missing = new ArrayList<>();
        fragment.referencedTables().stream()
            .filter(table -> !catalog.hasTable(table))
            .forEach(table -> missing.add("table " + table));
        fragment.referencedColumns().stream()
            .filter(ref -> {
                int dot = ref.indexOf('.');
                String table = ref.substring(0, dot);
                return catalog.hasTable(table) && !catalog.hasColumn(table, ref.substring(dot + 1));
            })
            .forEach(ref -> missing.add("column " + ref));
        return missing;
    }
}
