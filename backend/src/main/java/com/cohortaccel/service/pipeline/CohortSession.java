package com.cohortaccel.service.pipeline;

import com.cohortaccel.catalog.CatalogAdapter;
import com.cohortaccel.catalog.CatalogSchema;
import com.cohortaccel.concept.ConceptResolutionService;
import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.criteria.ConceptResolution;
import com.cohortaccel.model.criteria.CriteriaSet;
import com.cohortaccel.model.criteria.Gap;
import com.cohortaccel.model.criteria.Predicate;
import com.cohortaccel.model.enums.ExecutionMode;
import com.cohortaccel.model.enums.GapKind;
import com.cohortaccel.model.enums.PipelineStage;
import com.cohortaccel.model.enums.Verifiability;
import com.cohortaccel.model.execution.ExecutionResult;
import com.cohortaccel.model.execution.RepairAttempt;
import com.cohortaccel.model.funnel.FunnelReport;
import com.cohortaccel.model.funnel.FunnelWarning;
import com.cohortaccel.model.plan.QueryPlan;
import com.cohortaccel.service.compiler.CompileException;
import com.cohortaccel.service.compiler.QueryCompilerService;
import com.cohortaccel.service.execution.ExecutionException;
import com.cohortaccel.service.execution.PlanRepairService;
import com.cohortaccel.service.execution.PlanRepairService.RepairOutcome;
import com.cohortaccel.service.execution.QueryExecutionService;
import com.cohortaccel.service.funnel.FragmentCache;
import com.cohortaccel.service.funnel.FunnelService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.*;

/**
 * One cohort-building session: owns the criteria set, every plan version, the
 * latest execution and funnel, and the fragment cache.
 * <p>
 * Automatic stages (concepts, compile, execute, repair, funnel) run back to
 * back until the session needs the operator, i.e. until it reaches
 * {@link PipelineStage#AWAITING_FEEDBACK}. The criteria set is the only input
 * to each stage decision. Once finalized the session rejects every mutation.
 */
@Slf4j
public class CohortSession {

    @Getter
    private final String sessionId;

    private final CriteriaInterpreter interpreter;
    private final ConceptResolutionService conceptService;
    private final CatalogAdapter catalogAdapter;
    private final QueryCompilerService compiler;
    private final QueryExecutionService executionService;
    private final PlanRepairService repairService;
    private final FunnelService funnelService;
    private final CohortProperties properties;
    private final FragmentCache cache = new FragmentCache();

    @Getter
    private PipelineStage stage = PipelineStage.COLLECTING_CRITERIA;
    @Getter
    private CriteriaSet criteriaSet;
    private CatalogSchema catalog;
    private volatile QueryPlan plan;
    private ExecutionResult lastExecution;
    private FunnelReport funnel;
    private int repairCount;

    private final List<QueryPlan> planHistory = new ArrayList<>();
    private final List<RepairAttempt> repairAttempts = new ArrayList<>();
    private final List<StageFailure> failures = new ArrayList<>();
    private final List<StageTransition> transitions = new ArrayList<>();

    CohortSession(
            String sessionId,
            CriteriaInterpreter interpreter,
            ConceptResolutionService conceptService,
            CatalogAdapter catalogAdapter,
            QueryCompilerService compiler,
            QueryExecutionService executionService,
            PlanRepairService repairService,
            FunnelService funnelService,
            CohortProperties properties) {
        this.sessionId = sessionId;
        this.interpreter = interpreter;
        this.conceptService = conceptService;
        this.catalogAdapter = catalogAdapter;
        this.compiler = compiler;
        this.executionService = executionService;
        this.repairService = repairService;
        this.funnelService = funnelService;
        this.properties = properties;
    }

    // ========================================================================
    // Criteria Intake
    // ========================================================================

    public synchronized ResultBundle submitCriteria(CriteriaSet criteria) {
        ensureMutable();
        if (stage != PipelineStage.COLLECTING_CRITERIA) {
            throw new IllegalStateException("Session " + sessionId + " already has criteria; submit a revision instead");
        }
        if (criteria == null || criteria.isEmpty()) {
            throw new IllegalArgumentException("Criteria set must contain at least one predicate");
        }
        this.criteriaSet = criteria;
        transition(PipelineStage.COMPILING_CONCEPTS,
            "criteria received: " + criteria.predicates().size() + " predicates");
        run();
        return bundle();
    }

    public synchronized ResultBundle submitCriteriaText(String criteriaText) {
        ensureMutable();
        return submitCriteria(interpreter.interpret(criteriaText));
    }

    // ========================================================================
    // Automatic Stages
    // ========================================================================

    private void run() {
        while (true) {
            switch (stage) {
                case COMPILING_CONCEPTS -> resolveConcepts();
                case COMPILING_QUERY -> compileQuery();
                case EXECUTING -> executePlan();
                case REPAIRING -> repairPlan();
                case FUNNELING -> computeFunnel();
                default -> {
                    return;
                }
            }
        }
    }

    private void resolveConcepts() {
        criteriaSet = conceptService.resolvePending(criteriaSet);
        long skipped = criteriaSet.predicates().stream().filter(p -> criteriaSet.isSkipped(p.id())).count();
        transition(PipelineStage.COMPILING_QUERY, "concepts resolved; " + skipped + " predicates skipped");
    }

    private void compileQuery() {
        try {
            if (catalog == null) {
                catalog = catalogAdapter.getSchema();
            }
            QueryPlan compiled = compiler.compile(criteriaSet, catalog, latestPlan());
            installPlan(compiled);
            repairCount = 0;
            transition(PipelineStage.EXECUTING, "plan " + compiled.planId() + " compiled");
        } catch (CompileException e) {
            // the previous plan does not implement this revision
            plan = null;
            lastExecution = null;
            funnel = null;
            fail(PipelineStage.COMPILING_QUERY, e.getKind().getValue(), e.getPredicateIds(), e.getMessage());
            transition(PipelineStage.AWAITING_FEEDBACK, "compile error " + e.getKind().getValue());
        }
    }

    private void executePlan() {
        lastExecution = executionService.execute(plan, ExecutionMode.COUNT);
        if (lastExecution.isOk()) {
            transition(PipelineStage.FUNNELING, lastExecution.rowCount() + " subjects");
            return;
        }
        String kind = lastExecution.errorKind().getValue();
        if (!lastExecution.errorKind().isRepairable()) {
            fail(PipelineStage.EXECUTING, kind, List.of(), lastExecution.errorMessage());
            transition(PipelineStage.AWAITING_FEEDBACK, kind + " is not repairable");
        } else if (repairCount >= properties.getPipeline().getMaxRepairAttempts()) {
            List<String> failing = repairAttempts.isEmpty() ? List.of()
                : repairAttempts.get(repairAttempts.size() - 1).failingPredicateIds();
            fail(PipelineStage.EXECUTING, kind, failing,
                "Repair budget of " + properties.getPipeline().getMaxRepairAttempts() + " attempts exhausted: "
                    + lastExecution.errorMessage());
            transition(PipelineStage.AWAITING_FEEDBACK, "repair budget exhausted");
        } else {
            transition(PipelineStage.REPAIRING, kind);
        }
    }

    private void repairPlan() {
        repairCount++;
        try {
            RepairOutcome outcome = repairService.repair(criteriaSet, plan, lastExecution, repairCount);
            criteriaSet = outcome.criteriaSet();
            catalog = outcome.catalog();
            installPlan(outcome.plan());
            repairAttempts.add(outcome.attempt());
            transition(PipelineStage.EXECUTING, "repair attempt " + repairCount + " produced v" + plan.version());
        } catch (CompileException e) {
            fail(PipelineStage.REPAIRING, e.getKind().getValue(), e.getPredicateIds(), e.getMessage());
            transition(PipelineStage.AWAITING_FEEDBACK, "repair could not recompile");
        }
    }

    private void computeFunnel() {
        try {
            funnel = funnelService.computeFunnel(plan, plan.fragmentIds(), cache);
            transition(PipelineStage.AWAITING_FEEDBACK,
                "funnel computed with " + funnel.warnings().size() + " warnings");
        } catch (ExecutionException e) {
            fail(PipelineStage.FUNNELING, e.getKind().getValue(), List.of(), e.getMessage());
            transition(PipelineStage.AWAITING_FEEDBACK, "funnel step failed");
        }
    }

    private void installPlan(QueryPlan next) {
        plan = next;
        lastExecution = null;
        funnel = null;
        planHistory.add(next);
        cache.bind(next);
    }

    private QueryPlan latestPlan() {
        return planHistory.isEmpty() ? null : planHistory.get(planHistory.size() - 1);
    }

    // ========================================================================
    // Operator Actions
    // ========================================================================

    /**
     * Recompute the funnel for a subset of predicates without touching session state.
     */
    public FunnelReport whatIf(Set<String> enabledPredicateIds) {
        QueryPlan current = requireExecutedPlan();
        return funnelService.computeFunnel(current, enabledPredicateIds, cache);
    }

    /**
     * Count-first preview of the current plan.
     */
    public ExecutionResult preview() {
        return executionService.execute(requirePlan(), ExecutionMode.PREVIEW);
    }

    /**
     * Operator feedback: an approval token finalizes, anything else is
     * interpreted as a revision.
     */
    public synchronized ResultBundle feedback(String text) {
        ensureMutable();
        requireStage(PipelineStage.AWAITING_FEEDBACK);
        if (isApproval(text)) {
            return approve();
        }
        return revise(interpreter.revise(criteriaSet, text));
    }

    public synchronized ResultBundle revise(CriteriaSet revised) {
        ensureMutable();
        requireStage(PipelineStage.AWAITING_FEEDBACK);
        if (revised == null || revised.isEmpty()) {
            throw new IllegalArgumentException("Revised criteria set must contain at least one predicate");
        }
        criteriaSet = revised.toBuilder().revision(criteriaSet.revision() + 1).build();
        transition(PipelineStage.REVISING, "revision " + criteriaSet.revision());
        if (!criteriaSet.pendingConceptResolutions().isEmpty()) {
            transition(PipelineStage.COMPILING_CONCEPTS,
                criteriaSet.pendingConceptResolutions().size() + " concepts to resolve");
        } else {
            transition(PipelineStage.COMPILING_QUERY, "no concepts pending");
        }
        run();
        return bundle();
    }

    public synchronized ResultBundle supplyResolution(String predicateId, ConceptResolution resolution) {
        ensureMutable();
        requireStage(PipelineStage.AWAITING_FEEDBACK);
        if (resolution == null || !resolution.resolved()) {
            throw new IllegalArgumentException("A manual resolution must be resolved");
        }
        CriteriaSet updated = criteriaSet
            .withPredicate(predicateId, p -> p.toBuilder()
                .verifiability(p.verifiability() == Verifiability.NON_RWD ? Verifiability.RWD : p.verifiability())
                .build())
            .withResolution(predicateId, resolution)
            .withoutGaps(predicateId, EnumSet.of(GapKind.MISSING_CATALOG_DATA));
        return revise(updated);
    }

    public synchronized ResultBundle selectAlternative(String predicateId, int alternativeIndex) {
        ensureMutable();
        Predicate predicate = criteriaSet.predicate(predicateId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown predicate: " + predicateId));
        if (predicate.conceptResolution() == null) {
            throw new IllegalArgumentException("Predicate " + predicateId + " has no alternatives");
        }
        return supplyResolution(predicateId, predicate.conceptResolution().selectAlternative(alternativeIndex));
    }

    /**
     * Accept a predicate as a documentation-only gap.
     */
    public synchronized ResultBundle acceptGap(String predicateId, String note) {
        ensureMutable();
        requireStage(PipelineStage.AWAITING_FEEDBACK);
        CriteriaSet updated = criteriaSet
            .withPredicate(predicateId, p -> p.toBuilder().verifiability(Verifiability.NON_RWD).build())
            .withGap(new Gap(predicateId, GapKind.NON_RWD,
                note != null ? note : "Accepted by the operator as not enforceable from data",
                null, false));
        return revise(updated);
    }

    public synchronized ResultBundle approve() {
        ensureMutable();
        requireStage(PipelineStage.AWAITING_FEEDBACK);
        QueryPlan approved = requireExecutedPlan();
        if (funnel == null) {
            throw new IllegalStateException("Session " + sessionId + " has no funnel for plan " + approved.planId());
        }
        transition(PipelineStage.FINALIZED, "approved on plan " + approved.planId());
        return bundle();
    }

    private boolean isApproval(String text) {
        if (text == null) {
            return false;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replaceAll("[.!]+$", "");
        return properties.getPipeline().getApprovalTokens().stream()
            .anyMatch(token -> token.equalsIgnoreCase(normalized));
    }

    // ========================================================================
    // Result Bundle
    // ========================================================================

    public synchronized ResultBundle bundle() {
        List<Gap> gaps = new ArrayList<>(criteriaSet != null ? criteriaSet.gaps() : List.of());
        if (plan != null) {
            plan.gaps().stream()
                .filter(g -> gaps.stream().noneMatch(x -> x.predicateId().equals(g.predicateId()) && x.kind() == g.kind()))
                .forEach(gaps::add);
        }
        List<FunnelWarning> warnings = new ArrayList<>();
        if (lastExecution != null) {
            warnings.addAll(lastExecution.flags());
        }
        if (funnel != null) {
            funnel.warnings().stream().filter(w -> !warnings.contains(w)).forEach(warnings::add);
        }
        List<String> assumptions = plan != null ? plan.assumptions()
            : criteriaSet != null ? criteriaSet.assumptions() : List.of();
        return new ResultBundle(sessionId, stage, criteriaSet, plan, lastExecution, funnel,
            gaps, warnings, assumptions, repairAttempts, failures, transitions);
    }

    public Optional<QueryPlan> currentPlan() {
        return Optional.ofNullable(plan);
    }

    public synchronized List<QueryPlan> planHistory() {
        return List.copyOf(planHistory);
    }

    // ========================================================================
    // State Machine
    // ========================================================================

    private void transition(PipelineStage next, String reason) {
        if (!stage.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Session " + sessionId + " cannot move from " + stage.getValue() + " to " + next.getValue());
        }
        transitions.add(new StageTransition(stage, next, reason, Instant.now()));
        log.info("Session {}: {} -> {} ({})", sessionId, stage.getValue(), next.getValue(), reason);
        stage = next;
    }

    private void fail(PipelineStage failedStage, String classification, List<String> predicateIds, String message) {
        failures.add(new StageFailure(failedStage, classification, predicateIds, message));
        log.warn("Session {}: {} failed with {} on {}: {}", sessionId, failedStage.getValue(), classification,
            predicateIds, message);
    }

    private void ensureMutable() {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " is finalized");
        }
    }

    private void requireStage(PipelineStage expected) {
        if (stage != expected) {
            throw new IllegalStateException(
                "Session " + sessionId + " is " + stage.getValue() + ", expected " + expected.getValue());
        }
    }

    private QueryPlan requirePlan() {
        QueryPlan current = plan;
        if (current == null) {
            throw new IllegalStateException("Session " + sessionId + " has no compiled plan");
        }
        return current;
    }

    /**
     * The plan compiled from the current criteria revision whose last execution succeeded.
     */
    private synchronized QueryPlan requireExecutedPlan() {
        QueryPlan current = requirePlan();
        if (current.criteriaRevision() != criteriaSet.revision()) {
            throw new IllegalStateException("Plan " + current.planId() + " was compiled for revision "
                + current.criteriaRevision() + ", criteria are at revision " + criteriaSet.revision());
        }
        if (lastExecution == null || !lastExecution.isOk()) {
            throw new IllegalStateException("Plan " + current.planId() + " has not executed successfully");
        }
        return current;
    }
}
