package com.mead.oncology.engine;

import com.mead.oncology.GuidelineFixtures;
import com.mead.oncology.model.Alignment;
import com.mead.oncology.model.AlignmentVerdict;
import com.mead.oncology.model.GuidelineEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class GuidelineMatcherTest {

    private final GuidelineMatcher matcher = new GuidelineMatcher();
    private final GuidelineEntry breast = GuidelineFixtures.breastStageII();

    @Test
    void firstRankedTreatment_isAligned() {
        AlignmentVerdict verdict = matcher.evaluate(breast, "Chemotherapy");

        assertThat(verdict.alignment()).isEqualTo(Alignment.ALIGNED);
        assertThat(verdict.recognized()).isTrue();
        assertThat(verdict.resolvedTreatment()).isEqualTo("Chemotherapy");
        assertThat(verdict.rank()).hasValue(1);
    }

    @Test
    void everyLowerRankedTreatment_isPartiallyAligned() {
        List<String> recommended = breast.recommendedTreatments();
        for (int i = 1; i < recommended.size(); i++) {
            AlignmentVerdict verdict = matcher.evaluate(breast, recommended.get(i));

            assertThat(verdict.alignment()).isEqualTo(Alignment.PARTIALLY_ALIGNED);
            assertThat(verdict.rank()).hasValue(i + 1);
        }
    }

    @Test
    void recognizedButNotRecommended_isNotAlignedAndRecognized() {
        AlignmentVerdict verdict = matcher.evaluate(breast, "targeted THERAPY");

        assertThat(verdict.alignment()).isEqualTo(Alignment.NOT_ALIGNED);
        assertThat(verdict.recognized()).isTrue();
        assertThat(verdict.resolvedTreatment()).isEqualTo("Targeted therapy");
        assertThat(verdict.rank()).isEmpty();
    }

    @Test
    void unknownTreatment_isNotAlignedAndFlaggedUnrecognized() {
        AlignmentVerdict verdict = matcher.evaluate(breast, "  UnlistedDrugX ");

        assertThat(verdict.alignment()).isEqualTo(Alignment.NOT_ALIGNED);
        assertThat(verdict.recognized()).isFalse();
        assertThat(verdict.resolvedTreatment()).isEqualTo("unlisteddrugx");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Chemotherapy", "chemotherapy", "CHEMOTHERAPY", "  Chemotherapy  ", "cHeMo "})
    void verdictIgnoresCaseAndSurroundingWhitespace(String spelling) {
        Map<String, String> synonyms = Map.of("chemo", "Chemotherapy");

        AlignmentVerdict verdict = matcher.evaluate(breast, spelling, synonyms);

        assertThat(verdict.alignment()).isEqualTo(Alignment.ALIGNED);
        assertThat(verdict.resolvedTreatment()).isEqualTo("Chemotherapy");
    }

    @Test
    void normalizationInvariance_holdsForEveryTreatmentOfEveryFixture() {
        for (GuidelineEntry entry : List.of(breast, GuidelineFixtures.lungStageIV(), GuidelineFixtures.prostateLowRisk())) {
            for (String treatment : entry.treatmentUniverse()) {
                List<AlignmentVerdict> verdicts = List.of(
                        matcher.evaluate(entry, treatment),
                        matcher.evaluate(entry, treatment.toUpperCase()),
                        matcher.evaluate(entry, treatment.toLowerCase()),
                        matcher.evaluate(entry, "\t " + treatment.replace(" ", "   ") + "\n"));

                assertThat(verdicts.stream().collect(Collectors.toSet()))
                        .as("verdicts for %s", treatment)
                        .hasSize(1);
            }
        }
    }

    @Test
    void synonymOnlyApplies_whenExactMatchFails() {
        Map<String, String> synonyms = Map.of("surgery", "Chemotherapy");

        AlignmentVerdict verdict = matcher.evaluate(breast, "Surgery", synonyms);

        assertThat(verdict.alignment()).isEqualTo(Alignment.PARTIALLY_ALIGNED);
        assertThat(verdict.resolvedTreatment()).isEqualTo("Surgery");
    }

    @Test
    void synonymToTreatmentUnknownToEntry_staysUnrecognized() {
        Map<String, String> synonyms = Map.of("adt", "Androgen deprivation therapy");

        AlignmentVerdict verdict = matcher.evaluate(breast, "ADT", synonyms);

        assertThat(verdict.recognized()).isFalse();
        assertThat(verdict.resolvedTreatment()).isEqualTo("adt");
    }
}
