package com.cohortaccel.concept;

import com.cohortaccel.PipelineFixture;
import com.cohortaccel.model.criteria.ConceptResolution;
import com.cohortaccel.model.enums.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceTableConceptResolverTest {

    private PipelineFixture fixture;
    private ReferenceTableConceptResolver resolver;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        resolver = fixture.referenceResolver();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void prefixMatchIsPrimaryAndSubstringIsAlternative() {
        ConceptResolution resolution = resolver.resolve("heart failure", ClinicalDomain.DIAGNOSIS, null);

        assertThat(resolution.resolved()).isTrue();
        assertThat(resolution.codeValues()).containsExactly("I50.9");
        assertThat(resolution.codeSystem()).isEqualTo(CodeSystem.ICD10CM);
        assertThat(resolution.matchingLogic()).isEqualTo(MatchingLogic.WILDCARD);
        assertThat(resolution.confidence()).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(resolution.alternatives()).singleElement().satisfies(alt -> {
            assertThat(alt.codeValues()).containsExactly("I50.22");
            assertThat(alt.confidence()).isEqualTo(ConfidenceLevel.LOW);
        });
    }

    @Test
    void exactDescriptionIsHighConfidence() {
        ConceptResolution resolution = resolver.resolve("Essential (primary) hypertension", ClinicalDomain.DIAGNOSIS, null);

        assertThat(resolution.confidence()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(resolution.codeValues()).containsExactly("I10");
        assertThat(resolution.alternatives()).isEmpty();
    }

    @Test
    void drugsResolveToIngredientGroup() {
        ConceptResolution resolution = resolver.resolve("metformin", ClinicalDomain.DRUG, null);

        assertThat(resolution.matchingLogic()).isEqualTo(MatchingLogic.INGREDIENT);
        assertThat(resolution.codeValues()).containsExactly("METFORMIN");
        assertThat(resolution.codeSystem()).isEqualTo(CodeSystem.NDC);
    }

    @Test
    void codeSystemHintWins() {
        ConceptResolution resolution = resolver.resolve("heart failure", ClinicalDomain.DIAGNOSIS, CodeSystem.ICD9CM);

        assertThat(resolution.codeSystem()).isEqualTo(CodeSystem.ICD9CM);
    }

    @Test
    void noMatchIsUnresolved() {
        ConceptResolution resolution = resolver.resolve("sarcoidosis", ClinicalDomain.DIAGNOSIS, null);

        assertThat(resolution.resolved()).isFalse();
        assertThat(resolution.notes()).isEqualTo("No ref_icd10 entries match 'sarcoidosis'");
    }

    @Test
    void domainWithoutReferenceTableIsUnresolved() {
        ConceptResolution resolution = resolver.resolve("HbA1c", ClinicalDomain.LAB, null);

        assertThat(resolution.resolved()).isFalse();
        assertThat(resolution.notes()).contains("No reference table");
    }
}
