package com.mead.oncology.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class CancerTypeTest {

    @ParameterizedTest
    @CsvSource({
            "II, II",
            "ii, II",
            "Stage II, II",
            "stage 2, II",
            "'  iv ', IV",
            "0, 0",
            "stage 0, 0"
    })
    void numberedStages_areCanonicalized(String raw, String expected) {
        assertThat(CancerType.BREAST.canonicalStage(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "LowRisk, LowRisk",
            "low risk, LowRisk",
            "LOW_RISK, LowRisk",
            "intermediate-risk, IntermediateRisk",
            "metastatic, Metastatic"
    })
    void prostateRiskGroups_areCanonicalized(String raw, String expected) {
        assertThat(CancerType.PROSTATE.canonicalStage(raw)).isEqualTo(expected);
    }

    @Test
    void stageOutsideScheme_isReturnedTrimmed() {
        assertThat(CancerType.COLORECTAL.canonicalStage(" VII ")).isEqualTo("VII");
        assertThat(CancerType.PROSTATE.canonicalStage("II")).isEqualTo("II");
        assertThat(CancerType.COLORECTAL.isValidStage("VII")).isFalse();
    }

    @Test
    void fromLabel_acceptsEnumNamesDisplayNamesAndAliases() {
        assertThat(CancerType.fromLabel("BREAST")).contains(CancerType.BREAST);
        assertThat(CancerType.fromLabel("  lung/nsclc ")).contains(CancerType.LUNG_NSCLC);
        assertThat(CancerType.fromLabel("Non-Small Cell Lung Cancer (NSCLC)")).contains(CancerType.LUNG_NSCLC);
        assertThat(CancerType.fromLabel("colon")).contains(CancerType.COLORECTAL);
        assertThat(CancerType.fromLabel("Prostate  Cancer")).contains(CancerType.PROSTATE);
        assertThat(CancerType.fromLabel("pancreatic")).isEmpty();
        assertThat(CancerType.fromLabel(" ")).isEmpty();
    }
}
