package com.cohortaccel.dto.mapper;

import com.cohortaccel.ClinicalTestData;
import com.cohortaccel.model.criteria.CriteriaSet;
import com.cohortaccel.model.criteria.Predicate;
import com.cohortaccel.model.enums.*;
import com.cohortaccel.model.execution.ExecutionResult;
import com.cohortaccel.service.pipeline.ResultBundle;
import com.cohortaccel.service.pipeline.StageTransition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CriteriaDocumentMapperTest {

    private static final String DOCUMENT = """
        {
          "study_id": "trial_001",
          "version": "1.0",
          "anchors": {
            "index_event": {"name": "first_t2dm", "description": "First T2DM diagnosis", "predicate_id": "I02"},
            "screening": {"fixed_date": "2020-01-01"}
          },
          "inclusion": [
            {
              "id": "I01",
              "description": "Adults aged 18-75 years",
              "domain": "demographic",
              "concept": "age",
              "value_constraint": {"operator": "between", "value": [18, 75], "unit": "years"},
              "verifiability": "rwd"
            },
            {
              "id": "I02",
              "description": "Type 2 diabetes",
              "domain": "diagnosis",
              "concept": "type 2 diabetes",
              "concept_resolution": {
                "resolved": true,
                "concept_ids": ["E11"],
                "code_system": "ICD10CM",
                "matching_logic": "wildcard",
                "confidence": "high",
                "alternatives": [
                  {"concept_ids": ["E11.9"], "description": "Uncomplicated only", "confidence": "medium"}
                ]
              },
              "count_constraint": {"operator": ">=", "count": 2, "within_days": 365},
              "verifiability": "rwd"
            },
            {
              "id": "I03",
              "description": "Poorly controlled",
              "domain": "lab",
              "concept": "HbA1c",
              "temporal": {"reference": "index_date", "during": "baseline"},
              "value_constraint": {"operator": ">=", "value": 7.0, "unit": "%"},
              "verifiability": "partial_rwd",
              "needs_definition": true,
              "candidate_definitions": ["most recent value", "any value"]
            }
          ],
          "exclusion": [
            {
              "id": "E01",
              "description": "Unable to consent",
              "domain": "observation",
              "concept": "consent capacity",
              "verifiability": "rwd"
            }
          ],
          "assumptions_and_gaps": [
            {"predicate_id": "I03", "issue": "Lab units vary", "requires_user_input": false}
          ],
          "non_rwd_gates": ["E01"],
          "some_future_field": 42
        }
        """;

    private CriteriaDocumentMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new CriteriaDocumentMapper(new ObjectMapper().findAndRegisterModules());
    }

    @Nested
    @DisplayName("Reading documents")
    class Reading {

        @Test
        void mapsOriginalDocumentShape() {
            CriteriaSet set = mapper.read(DOCUMENT);

            assertThat(set.studyId()).isEqualTo("trial_001");
            assertThat(set.inclusions()).extracting(Predicate::id).containsExactly("I01", "I02", "I03");
            assertThat(set.exclusions()).extracting(Predicate::id).containsExactly("E01");

            Predicate age = set.predicate("I01").orElseThrow();
            assertThat(age.valueConstraint().operator()).isEqualTo(ComparisonOperator.BETWEEN);
            assertThat(age.valueConstraint().value()).isEqualByComparingTo(BigDecimal.valueOf(18));
            assertThat(age.valueConstraint().upperValue()).isEqualByComparingTo(BigDecimal.valueOf(75));

            Predicate diabetes = set.predicate("I02").orElseThrow();
            assertThat(diabetes.conceptResolution().matchingLogic()).isEqualTo(MatchingLogic.WILDCARD);
            assertThat(diabetes.conceptResolution().alternatives()).hasSize(1);
            assertThat(diabetes.countConstraint().withinDays()).isEqualTo(365);

            Predicate lab = set.predicate("I03").orElseThrow();
            assertThat(lab.needsDefinition()).isTrue();
            assertThat(lab.candidateDefinitions()).containsExactly("most recent value", "any value");
            assertThat(lab.temporalWindow().during()).isEqualTo("baseline");
            assertThat(lab.verifiability()).isEqualTo(Verifiability.PARTIAL_RWD);
        }

        @Test
        void nonRwdGatesOverrideVerifiability() {
            CriteriaSet set = mapper.read(DOCUMENT);

            assertThat(set.predicate("E01").orElseThrow().verifiability()).isEqualTo(Verifiability.NON_RWD);
        }

        @Test
        void anchorKindsAreInferred() {
            CriteriaSet set = mapper.read(DOCUMENT);

            assertThat(set.indexAnchor()).isEqualTo("first_t2dm");
            assertThat(set.indexAnchorRule().orElseThrow().kind()).isEqualTo(AnchorKind.FIRST_QUALIFYING_EVENT);
            assertThat(set.anchor("screening").orElseThrow().kind()).isEqualTo(AnchorKind.FIXED_DATE);
        }

        @Test
        void gapsDefaultToAssumptions() {
            CriteriaSet set = mapper.read(DOCUMENT);

            assertThat(set.gaps()).singleElement()
                .satisfies(g -> assertThat(g.kind()).isEqualTo(GapKind.ASSUMPTION));
            assertThat(set.isSkipped("I03")).isFalse();
        }

        @Test
        void rejectsMalformedRanges() {
            String badRange = DOCUMENT.replace("\"value\": [18, 75]", "\"value\": [18, 45, 75]");

            assertThatThrownBy(() -> mapper.read(badRange))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("I01");
        }

        @Test
        void rejectsUnorderedRanges() {
            String reversed = DOCUMENT.replace("\"value\": [18, 75]", "\"value\": [75, 18]");

            assertThatThrownBy(() -> mapper.read(reversed)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejectsNonNumericCounts() {
            String wordCount = DOCUMENT.replace("\"count\": 2,", "\"count\": \"two\",");
            String fractionalCount = DOCUMENT.replace("\"count\": 2,", "\"count\": 1.5,");

            assertThatThrownBy(() -> mapper.read(wordCount))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("count is not a whole number: two");
            assertThatThrownBy(() -> mapper.read(fractionalCount))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("count is not a whole number");
        }

        @Test
        void acceptsCountWrittenAsText() {
            CriteriaSet set = mapper.read(DOCUMENT.replace("\"count\": 2,", "\"count\": \"2\","));

            assertThat(set.predicate("I02").orElseThrow().countConstraint().count()).isEqualTo(2);
        }

        @Test
        void rejectsMalformedJson() {
            assertThatThrownBy(() -> mapper.read("{\"study_id\": "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Malformed criteria document");
        }
    }

    @Nested
    @DisplayName("Writing documents")
    class Writing {

        @Test
        void writtenDocumentReadsBackToSameCriteria() {
            CriteriaSet original = mapper.read(DOCUMENT);

            CriteriaSet reread = mapper.read(mapper.write(original));

            assertThat(reread.predicates())
                .usingRecursiveComparison()
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .isEqualTo(original.predicates());
            assertThat(reread.indexAnchor()).isEqualTo(original.indexAnchor());
            assertThat(reread.anchorRules()).isEqualTo(original.anchorRules());
        }

        @Test
        void bundleCarriesStageAndCriteria() throws Exception {
            CriteriaSet set = ClinicalTestData.adultsWithoutHeartFailure();
            ResultBundle bundle = new ResultBundle("s-1", PipelineStage.AWAITING_FEEDBACK, set, null,
                ExecutionResult.ok(ExecutionMode.COUNT, 1, 368, 12.5, List.of(), List.of(), List.of()),
                null, set.gaps(), List.of(), List.of(), List.of(), List.of(),
                List.of(new StageTransition(PipelineStage.FUNNELING, PipelineStage.AWAITING_FEEDBACK,
                    "funnel computed", Instant.parse("2024-01-01T00:00:00Z"))));

            JsonNode json = new ObjectMapper().readTree(mapper.writeBundle(bundle));

            assertThat(json.get("session_id").asText()).isEqualTo("s-1");
            assertThat(json.get("stage").asText()).isEqualTo("awaiting_feedback");
            assertThat(json.get("criteria").get("study_id").asText()).isEqualTo(ClinicalTestData.STUDY_ID);
            assertThat(json.get("execution").get("rowCount").asLong()).isEqualTo(368);
            assertThat(json.has("plan")).isFalse();
            assertThat(json.get("transitions")).hasSize(1);
        }
    }
}
