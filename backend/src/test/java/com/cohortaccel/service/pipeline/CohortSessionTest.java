package com.cohortaccel.service.pipeline;

import com.cohortaccel.ClinicalTestData;
import com.cohortaccel.PipelineFixture;
import com.cohortaccel.catalog.CatalogAdapter;
import com.cohortaccel.catalog.CatalogSchema;
import com.cohortaccel.model.criteria.*;
import com.cohortaccel.model.enums.*;
import com.cohortaccel.model.execution.RepairAttempt;
import com.cohortaccel.model.funnel.FunnelReport;
import com.cohortaccel.model.funnel.FunnelStep;
import com.cohortaccel.model.plan.QueryPlan;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CohortSessionTest {

    @Mock
    private CriteriaInterpreter interpreter;

    private PipelineFixture fixture;
    private CohortSession session;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        session = fixture.sessionFactory(interpreter, fixture.referenceResolver()).create("session-1");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    /**
     * Adults without heart failure, with the heart failure concept left for the resolver.
     */
    private static CriteriaSet unresolvedCriteria() {
        return CriteriaSet.builder()
            .studyId(ClinicalTestData.STUDY_ID)
            .predicates(List.of(ClinicalTestData.adults(), ClinicalTestData.heartFailureExclusion(null)))
            .build();
    }

    private static Predicate sarcoidosisExclusion() {
        return Predicate.builder()
            .id("E02")
            .description("Sarcoidosis")
            .polarity(Polarity.EXCLUSION)
            .domain(ClinicalDomain.DIAGNOSIS)
            .concept("sarcoidosis")
            .build();
    }

    @Nested
    @DisplayName("Automatic stages")
    class AutomaticStages {

        @Test
        void runsThroughToFeedback() {
            ResultBundle bundle = session.submitCriteria(unresolvedCriteria());

            assertThat(bundle.sessionId()).isEqualTo("session-1");
            assertThat(bundle.stage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);
            assertThat(bundle.transitions()).extracting(StageTransition::to).containsExactly(
                PipelineStage.COMPILING_CONCEPTS,
                PipelineStage.COMPILING_QUERY,
                PipelineStage.EXECUTING,
                PipelineStage.FUNNELING,
                PipelineStage.AWAITING_FEEDBACK);
            assertThat(bundle.criteriaSet().predicate("E01").orElseThrow().conceptResolution().codeValues())
                .containsExactly("I50.9");
            assertThat(bundle.execution().rowCount()).isEqualTo(368);
            assertThat(bundle.funnel().steps()).extracting(FunnelStep::count).containsExactly(500L, 380L, 368L);
            assertThat(bundle.failures()).isEmpty();
            assertThat(bundle.repairAttempts()).isEmpty();
            assertThat(session.planHistory()).hasSize(1);
        }

        @Test
        void unresolvableConceptIsSkippedAndReported() {
            CriteriaSet criteria = unresolvedCriteria().toBuilder()
                .predicates(List.of(ClinicalTestData.adults(), sarcoidosisExclusion()))
                .build();

            ResultBundle bundle = session.submitCriteria(criteria);

            assertThat(bundle.stage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);
            assertThat(bundle.plan().fragmentIds()).containsExactly("I01");
            assertThat(bundle.gaps()).extracting(Gap::predicateId, Gap::kind)
                .containsExactly(tuple("E02", GapKind.UNRESOLVED_CONCEPT));
            assertThat(bundle.execution().rowCount()).isEqualTo(ClinicalTestData.ADULTS);
        }

        @Test
        void compileErrorWaitsForOperator() {
            Predicate diabetes = ClinicalTestData.diabetesInclusion("I02").toBuilder()
                .temporalWindow(TemporalWindow.lookback("screening_visit", 365))
                .build();

            ResultBundle bundle = session.submitCriteria(CriteriaSet.builder()
                .studyId(ClinicalTestData.STUDY_ID)
                .predicates(List.of(diabetes))
                .build());

            assertThat(bundle.stage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);
            assertThat(bundle.plan()).isNull();
            assertThat(bundle.failures()).singleElement().satisfies(failure -> {
                assertThat(failure.stage()).isEqualTo(PipelineStage.COMPILING_QUERY);
                assertThat(failure.classification()).isEqualTo("invalid_temporal_reference");
                assertThat(failure.predicateIds()).containsExactly("I02");
            });
            assertThatThrownBy(() -> session.whatIf(Set.of("I02"))).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(session::approve).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void rejectsEmptyOrRepeatedSubmission() {
            CriteriaSet empty = CriteriaSet.builder().studyId(ClinicalTestData.STUDY_ID).build();

            assertThatThrownBy(() -> session.submitCriteria(empty)).isInstanceOf(IllegalArgumentException.class);
            assertThat(session.getStage()).isEqualTo(PipelineStage.COLLECTING_CRITERIA);

            session.submitCriteria(ClinicalTestData.adultsWithoutHeartFailure());
            assertThatThrownBy(() -> session.submitCriteria(ClinicalTestData.adultsWithoutHeartFailure()))
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void textIsHandedToInterpreter() {
            when(interpreter.interpret("adults without heart failure"))
                .thenReturn(ClinicalTestData.adultsWithoutHeartFailure());

            ResultBundle bundle = session.submitCriteriaText("adults without heart failure");

            assertThat(bundle.execution().rowCount()).isEqualTo(368);
        }
    }

    @Nested
    @DisplayName("Operator feedback")
    class Feedback {

        @BeforeEach
        void submit() {
            session.submitCriteria(ClinicalTestData.adultsWithoutHeartFailure());
        }

        @Test
        void approvalTokenFinalizes() {
            ResultBundle bundle = session.feedback("  Ship it! ");

            assertThat(bundle.isFinalized()).isTrue();
            assertThat(bundle.transitions()).last()
                .satisfies(t -> assertThat(t.to()).isEqualTo(PipelineStage.FINALIZED));
            verifyNoInteractions(interpreter);
        }

        @Test
        void finalizedSessionRejectsMutations() {
            session.approve();

            assertThatThrownBy(() -> session.feedback("drop E01"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is finalized");
            assertThatThrownBy(() -> session.revise(ClinicalTestData.adultsWithoutHeartFailure()))
                .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> session.acceptGap("E01", null)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> session.submitCriteria(ClinicalTestData.adultsWithoutHeartFailure()))
                .isInstanceOf(IllegalStateException.class);
            assertThat(session.whatIf(Set.of("I01")).finalCount()).isEqualTo(ClinicalTestData.ADULTS);
        }

        @Test
        void freeTextFeedbackIsARevision() {
            CriteriaSet current = session.getCriteriaSet();
            CriteriaSet adultsOnly = current.toBuilder().predicates(List.of(ClinicalTestData.adults())).build();
            when(interpreter.revise(eq(current), eq("drop the heart failure exclusion"))).thenReturn(adultsOnly);

            ResultBundle bundle = session.feedback("drop the heart failure exclusion");

            assertThat(bundle.criteriaSet().revision()).isEqualTo(1);
            assertThat(bundle.plan().version()).isEqualTo(2);
            assertThat(bundle.plan().parentVersion()).isEqualTo(1);
            assertThat(bundle.execution().rowCount()).isEqualTo(ClinicalTestData.ADULTS);
            assertThat(bundle.transitions()).extracting(StageTransition::from, StageTransition::to)
                .contains(
                    tuple(PipelineStage.AWAITING_FEEDBACK, PipelineStage.REVISING),
                    tuple(PipelineStage.REVISING, PipelineStage.COMPILING_QUERY));
            assertThat(session.planHistory()).extracting(QueryPlan::version).containsExactly(1, 2);
        }

        @Test
        void revisionWithNewConceptResolvesIt() {
            CriteriaSet revised = session.getCriteriaSet().toBuilder()
                .predicates(List.of(ClinicalTestData.adults(), ClinicalTestData.heartFailureExclusion(null)))
                .build();

            ResultBundle bundle = session.revise(revised);

            assertThat(bundle.transitions()).extracting(StageTransition::from, StageTransition::to)
                .contains(tuple(PipelineStage.REVISING, PipelineStage.COMPILING_CONCEPTS));
            assertThat(bundle.execution().rowCount()).isEqualTo(368);
        }

        @Test
        void acceptedGapIsDocumentationOnly() {
            ResultBundle bundle = session.acceptGap("E01", "History not required for this feasibility count");

            assertThat(bundle.criteriaSet().predicate("E01").orElseThrow().verifiability())
                .isEqualTo(Verifiability.NON_RWD);
            assertThat(bundle.gaps()).singleElement().satisfies(gap -> {
                assertThat(gap.kind()).isEqualTo(GapKind.NON_RWD);
                assertThat(gap.requiresUserInput()).isFalse();
            });
            assertThat(bundle.plan().fragmentIds()).containsExactly("I01");
            assertThat(bundle.execution().rowCount()).isEqualTo(ClinicalTestData.ADULTS);
        }

        @Test
        void whatIfLeavesSessionUntouched() {
            QueryPlan before = session.currentPlan().orElseThrow();

            FunnelReport exclusionOnly = session.whatIf(Set.of("E01"));
            FunnelReport everything = session.whatIf(before.fragmentIds());

            assertThat(exclusionOnly.finalCount()).isEqualTo(488);
            assertThat(everything.finalCount()).isEqualTo(session.bundle().execution().rowCount());
            assertThat(session.currentPlan()).containsSame(before);
            assertThat(session.getStage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);
        }

        @Test
        void revisionThatFailsToCompileCannotBeApproved() {
            Predicate diabetes = ClinicalTestData.diabetesInclusion("I02").toBuilder()
                .temporalWindow(TemporalWindow.lookback("screening_visit", 365))
                .build();
            CriteriaSet current = session.getCriteriaSet();
            List<Predicate> withDiabetes = List.of(ClinicalTestData.adults(), diabetes,
                current.predicate("E01").orElseThrow());

            ResultBundle failed = session.revise(current.toBuilder().predicates(withDiabetes).build());

            assertThat(failed.stage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);
            assertThat(failed.criteriaSet().revision()).isEqualTo(1);
            assertThat(failed.plan()).isNull();
            assertThat(failed.execution()).isNull();
            assertThat(failed.funnel()).isNull();
            assertThatThrownBy(session::approve).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> session.feedback("approve")).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> session.whatIf(Set.of("I01"))).isInstanceOf(IllegalStateException.class);
            assertThat(session.getStage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);

            ResultBundle fixed = session.revise(ClinicalTestData.adultsWithoutHeartFailure());

            assertThat(fixed.plan().planId()).isEqualTo(ClinicalTestData.STUDY_ID + "@r2v2");
            assertThat(fixed.plan().parentVersion()).isEqualTo(1);
            assertThat(session.approve().isFinalized()).isTrue();
        }

        @Test
        void previewReturnsRows() {
            assertThat(session.preview().previewRows()).hasSize(10);
        }
    }

    @Nested
    @DisplayName("Manual resolutions")
    class ManualResolutions {

        @Test
        void suppliedResolutionReplacesSkip() {
            session.submitCriteria(unresolvedCriteria().toBuilder()
                .predicates(List.of(ClinicalTestData.adults(), sarcoidosisExclusion()))
                .build());

            ResultBundle bundle = session.supplyResolution("E02",
                ClinicalTestData.codes(MatchingLogic.WILDCARD, CodeSystem.ICD10CM, "E11"));

            assertThat(bundle.gaps()).isEmpty();
            assertThat(bundle.plan().fragmentIds()).containsExactly("I01", "E02");
            assertThat(bundle.execution().rowCount())
                .isEqualTo(ClinicalTestData.ADULTS - ClinicalTestData.ADULTS_WITH_DIABETES);
        }

        @Test
        void unresolvedManualResolutionIsRejected() {
            session.submitCriteria(ClinicalTestData.adultsWithoutHeartFailure());

            assertThatThrownBy(() -> session.supplyResolution("E01", ConceptResolution.unresolved("?", null)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void alternativeCanBePromoted() {
            session.submitCriteria(unresolvedCriteria());

            ResultBundle bundle = session.selectAlternative("E01", 0);

            ConceptResolution resolution = bundle.criteriaSet().predicate("E01").orElseThrow().conceptResolution();
            assertThat(resolution.codeValues()).containsExactly("I50.22");
            assertThat(resolution.alternatives()).first()
                .satisfies(previous -> assertThat(previous.codeValues()).containsExactly("I50.9"));
            // I50.22 is only recorded for subjects outside the age range
            assertThat(bundle.execution().rowCount()).isEqualTo(ClinicalTestData.ADULTS);
        }
    }

    @Nested
    @DisplayName("Repair loop")
    class RepairLoop {

        @Mock
        private CatalogAdapter catalogAdapter;

        private PipelineFixture phantomFixture;
        private CatalogSchema declared;
        private CatalogSchema actual;

        @BeforeEach
        void phantomColumn() {
            phantomFixture = new PipelineFixture(ClinicalTestData.propertiesWithPhantomDiagnosisColumn());
            actual = ClinicalTestData.catalog(phantomFixture.getProperties());
            declared = ClinicalTestData.withColumn(actual, "claims", ClinicalTestData.PHANTOM_COLUMN);
        }

        @AfterEach
        void closePhantom() {
            phantomFixture.close();
        }

        private CohortSession phantomSession() {
            return phantomFixture.sessionFactory(interpreter, phantomFixture.referenceResolver(), catalogAdapter)
                .create();
        }

        @Test
        void stopsAfterRepairBudget() {
            when(catalogAdapter.getSchema()).thenReturn(declared);

            ResultBundle bundle = phantomSession().submitCriteria(ClinicalTestData.adultsWithoutHeartFailure());

            assertThat(bundle.stage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);
            assertThat(bundle.repairAttempts()).extracting(RepairAttempt::attempt).containsExactly(1, 2, 3);
            assertThat(bundle.repairAttempts()).allSatisfy(a -> {
                assertThat(a.errorKind()).isEqualTo(ExecutionErrorKind.SCHEMA_ERROR);
                assertThat(a.failingPredicateIds()).containsExactly("E01");
            });
            assertThat(bundle.plan().version()).isEqualTo(4);
            assertThat(bundle.failures()).singleElement().satisfies(failure -> {
                assertThat(failure.stage()).isEqualTo(PipelineStage.EXECUTING);
                assertThat(failure.classification()).isEqualTo("schema_error");
                assertThat(failure.predicateIds()).containsExactly("E01");
                assertThat(failure.message()).startsWith("Repair budget of 3 attempts exhausted");
            });
            assertThat(bundle.funnel()).isNull();
            verify(catalogAdapter, times(4)).getSchema();
        }

        @Test
        void failedPlanCannotBeApproved() {
            when(catalogAdapter.getSchema()).thenReturn(declared);
            CohortSession phantom = phantomSession();
            phantom.submitCriteria(ClinicalTestData.adultsWithoutHeartFailure());

            assertThatThrownBy(() -> phantom.feedback("approve"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("has not executed successfully");
            assertThatThrownBy(() -> phantom.whatIf(Set.of("I01"))).isInstanceOf(IllegalStateException.class);
            assertThat(phantom.getStage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);
            verifyNoInteractions(interpreter);
        }

        @Test
        void repairBudgetIsConfigurable() {
            phantomFixture.getProperties().getPipeline().setMaxRepairAttempts(1);
            when(catalogAdapter.getSchema()).thenReturn(declared);

            ResultBundle bundle = phantomSession().submitCriteria(ClinicalTestData.adultsWithoutHeartFailure());

            assertThat(bundle.repairAttempts()).hasSize(1);
            assertThat(bundle.failures()).singleElement()
                .satisfies(f -> assertThat(f.message()).startsWith("Repair budget of 1 attempts exhausted"));
        }

        @Test
        void demotionLetsTheRetrySucceed() {
            when(catalogAdapter.getSchema()).thenReturn(declared, actual);

            ResultBundle bundle = phantomSession().submitCriteria(ClinicalTestData.adultsWithoutHeartFailure());

            assertThat(bundle.stage()).isEqualTo(PipelineStage.AWAITING_FEEDBACK);
            assertThat(bundle.transitions()).extracting(StageTransition::to).containsSubsequence(
                PipelineStage.EXECUTING, PipelineStage.REPAIRING, PipelineStage.EXECUTING,
                PipelineStage.FUNNELING, PipelineStage.AWAITING_FEEDBACK);
            assertThat(bundle.criteriaSet().revision()).isEqualTo(1);
            assertThat(bundle.gaps()).extracting(Gap::predicateId, Gap::kind)
                .containsExactly(tuple("E01", GapKind.MISSING_CATALOG_DATA));
            assertThat(bundle.repairAttempts()).singleElement()
                .satisfies(a -> assertThat(a.diff().demotedPredicates()).containsExactly("E01"));
            assertThat(bundle.execution().rowCount()).isEqualTo(ClinicalTestData.ADULTS);
            assertThat(bundle.failures()).isEmpty();
        }
    }

    @Test
    void factoryAssignsSessionIds() {
        CohortSessionFactory factory = fixture.sessionFactory(interpreter, fixture.referenceResolver());

        assertThat(factory.create().getSessionId()).isNotBlank().isNotEqualTo(factory.create().getSessionId());
        verify(interpreter, never()).interpret(any());
    }
}
