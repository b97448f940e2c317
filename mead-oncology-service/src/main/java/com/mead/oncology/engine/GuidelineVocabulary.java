package com.mead.oncology.engine;

import com.mead.oncology.model.AlignmentVerdict;
import com.mead.oncology.model.GuidelineEntry;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain-language wording for stages, evidence levels and verdicts shown to patients.
 */
public final class GuidelineVocabulary {

    private static final Map<String, String> STAGE_LABELS = Map.of(
            "0", "Stage 0",
            "I", "Stage I",
            "II", "Stage II",
            "III", "Stage III",
            "IV", "Stage IV",
            "LowRisk", "Low Risk",
            "IntermediateRisk", "Intermediate Risk",
            "HighRisk", "High Risk",
            "Metastatic", "Metastatic"
    );

    private static final Map<String, String> STAGE_DESCRIPTIONS = Map.of(
            "0", "Carcinoma in situ",
            "I", "Small, localized tumor",
            "II", "Larger tumor or limited lymph node spread",
            "III", "Regional lymph node involvement",
            "IV", "Metastatic disease",
            "LowRisk", "Slow-growing cancer confined to the prostate",
            "IntermediateRisk", "Cancer confined to the prostate with features of moderate growth",
            "HighRisk", "Aggressive or locally advanced cancer",
            "Metastatic", "Cancer has spread beyond the prostate"
    );

    private static final Map<String, String> EVIDENCE_EXPLANATIONS = Map.of(
            "Category 1", "Highest confidence - based on extensive research and expert agreement. "
                    + "This is the standard treatment that doctors worldwide recommend.",
            "Category 2A", "High confidence - strong evidence supports this approach. Most doctors would recommend this.",
            "Category 2B", "Moderate confidence - some evidence supports this, but there may be other good options too.",
            "Category 3", "Lower confidence - limited research available. Doctors may disagree on this approach."
    );

    private static final Map<String, String> TREATMENT_EXPLANATIONS = Map.ofEntries(
            Map.entry("Surgery (lumpectomy) + Radiation",
                    "A small surgery removes just the tumor (not the whole breast), followed by radiation to the breast area."),
            Map.entry("Surgery + Radiation",
                    "The tumor is removed through surgery, followed by radiation therapy to kill any remaining cancer cells in the area."),
            Map.entry("Neoadjuvant chemotherapy → Surgery → Adjuvant therapy",
                    "First, you receive chemotherapy to shrink the tumor. Then surgery to remove it. "
                            + "Finally, additional treatment to prevent cancer from coming back."),
            Map.entry("Neoadjuvant chemotherapy → Surgery → Radiation + Adjuvant therapy",
                    "Treatment starts with chemotherapy to shrink the tumor, then surgery to remove it, "
                            + "radiation to target the area, and follow-up treatment to reduce recurrence risk."),
            Map.entry("Surgical resection (lobectomy)",
                    "Surgery to remove the part of the lung containing the tumor."),
            Map.entry("Surgery + Adjuvant chemotherapy",
                    "Surgery removes the tumor, followed by chemotherapy to kill any remaining cancer cells."),
            Map.entry("Concurrent chemoradiation → Durvalumab (if PD-L1+)",
                    "Chemotherapy and radiation given together, followed by immunotherapy drug (Durvalumab) "
                            + "if tests show your cancer is likely to respond."),
            Map.entry("Surgical resection only",
                    "Surgery to remove the tumor is the only treatment needed at this stage."),
            Map.entry("Surgery + Adjuvant FOLFOX/CAPOX (6 months)",
                    "Surgery removes the tumor, followed by 6 months of chemotherapy using drug combinations (FOLFOX or CAPOX)."),
            Map.entry("Chemotherapy → Surgery",
                    "Chemotherapy first to shrink the tumor, then surgery to remove it."),
            Map.entry("Active surveillance (preferred)",
                    "Closely monitoring the cancer with regular tests instead of immediate treatment, because the cancer is slow-growing."),
            Map.entry("Radical prostatectomy OR Radiation + ADT (4-6 months)",
                    "Either complete removal of the prostate through surgery, OR radiation therapy combined with "
                            + "hormone therapy for 4-6 months."),
            Map.entry("Radiation + ADT (18-36 months)",
                    "Radiation therapy to the prostate area, combined with hormone therapy for 18-36 months to shrink the cancer.")
    );

    // Applied in order: "neoadjuvant" must be replaced before "adjuvant".
    private static final List<Map.Entry<Pattern, String>> JARGON = List.of(
            jargon("neoadjuvant", "pre-surgery"),
            jargon("adjuvant", "follow-up"),
            jargon("resection", "surgical removal"),
            jargon("lobectomy", "lung surgery"),
            jargon("lumpectomy", "tumor removal surgery"),
            jargon("mastectomy", "breast removal surgery"),
            jargon("prostatectomy", "prostate removal surgery"),
            jargon("→", ", then"),
            jargon("+", " combined with"),
            jargon("CDK4/6 inhibitor", "cancer growth blocker"),
            jargon("hormonal therapy", "hormone treatment"),
            jargon("immunotherapy", "immune system treatment"),
            jargon("palliative", "symptom management")
    );

    private static final Pattern SPACE_BEFORE_COMMA = Pattern.compile("\\s+,");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String DEFAULT_EVIDENCE_EXPLANATION =
            "This treatment is supported by medical research and clinical experience.";

    public static String stageLabel(String stage) {
        return STAGE_LABELS.getOrDefault(stage, "Stage " + stage);
    }

    public static String stageDescription(String stage) {
        return STAGE_DESCRIPTIONS.getOrDefault(stage, "Not available");
    }

    public static String evidenceExplanation(String evidenceLevel) {
        if (evidenceLevel == null) return DEFAULT_EVIDENCE_EXPLANATION;
        return EVIDENCE_EXPLANATIONS.getOrDefault(evidenceLevel, DEFAULT_EVIDENCE_EXPLANATION);
    }

    /**
     * Patient-facing version of a guideline's standard treatment text. Known texts have a hand-written
     * explanation; anything else gets its medical terms replaced.
     */
    public static String simplifyTreatmentText(String technicalText) {
        if (technicalText == null || technicalText.isBlank()) return "";
        String explained = TREATMENT_EXPLANATIONS.get(technicalText.strip());
        if (explained != null) return explained;

        String simplified = technicalText;
        for (Map.Entry<Pattern, String> term : JARGON) {
            simplified = term.getKey().matcher(simplified).replaceAll(Matcher.quoteReplacement(term.getValue()));
        }
        simplified = SPACE_BEFORE_COMMA.matcher(simplified).replaceAll(",");
        return WHITESPACE.matcher(simplified).replaceAll(" ").strip();
    }

    /**
     * "Guideline disagrees" and "no data to judge" are worded differently on purpose: both are
     * NOT_ALIGNED but only the first is a statement made by the guideline.
     */
    public static String alignmentSummary(GuidelineEntry entry, AlignmentVerdict verdict, String proposedTreatment) {
        String where = entry.cancerType().displayName() + " " + stageLabel(entry.stage());
        String treatment = proposedTreatment.strip();
        int total = entry.recommendedTreatments().size();

        switch (verdict.alignment()) {
            case ALIGNED:
                return treatment + " matches the first-line " + entry.guidelineSource()
                        + " recommendation for " + where + ".";
            case PARTIALLY_ALIGNED:
                return treatment + " is guideline-acceptable for " + where + " but is not first-line (ranked "
                        + verdict.rank().orElse(0) + " of " + total + "); the preferred option is "
                        + entry.recommendedTreatments().get(0) + ".";
            case NOT_ALIGNED:
                if (verdict.recognized()) {
                    return entry.guidelineSource() + " does not recommend " + treatment + " for " + where
                            + ". Discuss the recommended options with your oncologist.";
                }
                return treatment + " is not recognized for " + where
                        + ": there is no guideline data to judge it. Please verify it with your oncologist.";
            default:
                return "Guidelines are not currently available for " + where + ".";
        }
    }

    private static Map.Entry<Pattern, String> jargon(String term, String plain) {
        return Map.entry(Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), plain);
    }

    private GuidelineVocabulary() {}
}
