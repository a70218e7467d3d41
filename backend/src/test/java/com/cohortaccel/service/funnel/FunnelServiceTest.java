package com.cohortaccel.service.funnel;

import com.cohortaccel.ClinicalTestData;
import com.cohortaccel.PipelineFixture;
import com.cohortaccel.model.criteria.CriteriaSet;
import com.cohortaccel.model.criteria.Predicate;
import com.cohortaccel.model.enums.*;
import com.cohortaccel.model.funnel.FunnelReport;
import com.cohortaccel.model.funnel.FunnelStep;
import com.cohortaccel.model.funnel.FunnelWarning;
import com.cohortaccel.model.plan.QueryPlan;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class FunnelServiceTest {

    private PipelineFixture fixture;
    private FunnelService funnelService;
    private QueryPlan plan;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        funnelService = fixture.getFunnelService();
        plan = fixture.getCompiler().compile(ClinicalTestData.adultsWithoutHeartFailure(), fixture.catalog());
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Nested
    @DisplayName("Attrition steps")
    class Steps {

        @Test
        void fullPlanAttrition() {
            FunnelReport report = funnelService.computeFunnel(plan, Set.of("I01", "E01"));

            assertThat(report.planId()).isEqualTo(plan.planId());
            assertThat(report.steps())
                .extracting(FunnelStep::predicateId, FunnelStep::count, FunnelStep::percentOfBase,
                    FunnelStep::dropCount, FunnelStep::dropPercent)
                .containsExactly(
                    tuple("base", 500L, 100.0, 0L, 0.0),
                    tuple("I01", 380L, 76.0, 120L, 24.0),
                    tuple("final", 368L, 73.6, 12L, 3.2));
            assertThat(report.steps().get(1).stepLabel()).isEqualTo("I01: Adults aged 18-75 years");
            assertThat(report.steps().get(2).stepLabel()).isEqualTo("After exclusions");
            assertThat(report.warnings()).isEmpty();
        }

        @Test
        void emptySelectionReportsBaseOnly() {
            FunnelReport report = funnelService.computeFunnel(plan, Set.of());

            assertThat(report.steps()).singleElement().satisfies(step -> {
                assertThat(step.isBase()).isTrue();
                assertThat(step.count()).isEqualTo(ClinicalTestData.PATIENTS);
            });
            assertThat(report.baseCount()).isEqualTo(report.finalCount());
        }

        @Test
        void exclusionOnlySubtractsFromBase() {
            FunnelReport report = funnelService.computeFunnel(plan, Set.of("E01"));

            assertThat(report.steps()).extracting(FunnelStep::predicateId, FunnelStep::count)
                .containsExactly(tuple("base", 500L), tuple("final", 488L));
        }

        @Test
        void idsWithoutFragmentsAreIgnored() {
            FunnelReport report = funnelService.computeFunnel(plan, Set.of("I01", "X99"));

            assertThat(report.enabledPredicateIds()).containsExactly("I01");
            assertThat(report.finalCount()).isEqualTo(ClinicalTestData.ADULTS);
        }

        @Test
        void matchesTheCompiledAttritionQuery() {
            FunnelReport report = funnelService.computeFunnel(plan, plan.fragmentIds());

            List<Long> counts = fixture.getJdbcTemplate().queryForList(plan.funnelSql()).stream()
                .map(row -> ((Number) row.get("subject_count")).longValue())
                .toList();

            assertThat(report.steps()).extracting(FunnelStep::count).containsExactlyElementsOf(counts);
        }

        @Test
        void emptyPopulationReportsZeroPercentages() {
            fixture.getJdbcTemplate().update("delete from patients");

            FunnelReport report = funnelService.computeFunnel(plan, Set.of("I01", "E01"));

            assertThat(report.steps())
                .extracting(FunnelStep::predicateId, FunnelStep::count, FunnelStep::percentOfBase,
                    FunnelStep::dropCount, FunnelStep::dropPercent)
                .containsExactly(
                    tuple("base", 0L, 0.0, 0L, 0.0),
                    tuple("I01", 0L, 0.0, 0L, 0.0),
                    tuple("final", 0L, 0.0, 0L, 0.0));
        }

        @Test
        void finalCountAgreesWithPlanExecution() {
            FunnelReport report = funnelService.computeFunnel(plan, plan.fragmentIds());

            long executed = fixture.getExecutionService().execute(plan, ExecutionMode.COUNT).rowCount();

            assertThat(report.finalCount()).isEqualTo(executed);
        }
    }

    @Nested
    @DisplayName("Warnings")
    class Warnings {

        @Test
        void steepDropIsSuspicious() {
            Predicate metformin = Predicate.builder()
                .id("I04").description("Metformin use").polarity(Polarity.INCLUSION)
                .domain(ClinicalDomain.DRUG).concept("metformin")
                .conceptResolution(ClinicalTestData.codes(MatchingLogic.EXACT, CodeSystem.NDC, "00093104801"))
                .build();
            QueryPlan metforminPlan = fixture.getCompiler().compile(
                CriteriaSet.builder().studyId("MET").predicates(List.of(metformin)).build(), fixture.catalog());

            FunnelReport report = funnelService.computeFunnel(metforminPlan, Set.of("I04"));

            assertThat(report.finalCount()).isEqualTo(ClinicalTestData.ADULTS_ON_METFORMIN);
            assertThat(report.warnings()).singleElement().satisfies(w -> {
                assertThat(w.kind()).isEqualTo(FunnelWarningKind.SUSPICIOUS_DROP);
                assertThat(w.predicateId()).isEqualTo("I04");
                assertThat(w.message()).contains("removes 493 of 500");
            });
        }

        @Test
        void emptyFinalCohortIsFlagged() {
            Predicate nobody = ClinicalTestData.diabetesInclusion("I02").toBuilder()
                .conceptResolution(ClinicalTestData.codes(MatchingLogic.EXACT, CodeSystem.ICD10CM, "Q99.9"))
                .build();
            QueryPlan emptyPlan = fixture.getCompiler().compile(
                CriteriaSet.builder().studyId("NONE").predicates(List.of(nobody)).build(), fixture.catalog());

            FunnelReport report = funnelService.computeFunnel(emptyPlan, Set.of("I02"));

            assertThat(report.warnings()).extracting(FunnelWarning::kind, FunnelWarning::predicateId)
                .containsExactly(
                    tuple(FunnelWarningKind.SUSPICIOUS_DROP, "I02"),
                    tuple(FunnelWarningKind.EMPTY_COHORT, "final"));
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        void repeatedFunnelReusesCounts() {
            FragmentCache cache = new FragmentCache();

            FunnelReport first = funnelService.computeFunnel(plan, Set.of("I01", "E01"), cache);
            int cached = cache.cachedCountSize();
            FunnelReport second = funnelService.computeFunnel(plan, Set.of("I01", "E01"), cache);

            assertThat(cached).isEqualTo(3);
            assertThat(cache.cachedCountSize()).isEqualTo(cached);
            assertThat(second.steps()).isEqualTo(first.steps());
        }

        @Test
        void subsetSharesBaseCount() {
            FragmentCache cache = new FragmentCache();

            funnelService.computeFunnel(plan, Set.of("I01"), cache);
            funnelService.computeFunnel(plan, Set.of("I01", "E01"), cache);

            // base, I01 (also the final step while E01 is off), I01 minus E01
            assertThat(cache.cachedCountSize()).isEqualTo(3);
        }

        @Test
        void concurrentWhatIfsAgree() throws Exception {
            FragmentCache cache = new FragmentCache();
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<FunnelReport>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    Set<String> enabled = i % 2 == 0 ? Set.of("I01", "E01") : Set.of("E01");
                    futures.add(pool.submit(() -> funnelService.computeFunnel(plan, enabled, cache)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    assertThat(futures.get(i).get().finalCount()).isEqualTo(i % 2 == 0 ? 368L : 488L);
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    void percentagesHaveOneDecimal() {
        assertThat(FunnelService.percent(0, 0)).isEqualTo(0.0);
        assertThat(FunnelService.percent(1, 3)).isEqualTo(33.3);
        assertThat(FunnelService.percent(2, 3)).isEqualTo(66.7);
        assertThat(FunnelService.percent(5, 0)).isEqualTo(0.0);
    }
}
