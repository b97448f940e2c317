package com.mead.oncology.engine;

import com.mead.oncology.model.AlignmentVerdict;
import com.mead.oncology.model.GuidelineEntry;
import com.mead.oncology.model.Resolution;
import com.mead.oncology.model.TreatmentInsight;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up side effects, substitutes and biomarker tests for a matched treatment. Only data curated in
 * the entry is returned; unknown treatments get empty lists.
 */
@Component
public class RiskAlternativeResolver {

    public Resolution resolve(GuidelineEntry entry, AlignmentVerdict verdict) {
        return resolve(entry, verdict.resolvedTreatment(), verdict);
    }

    /**
     * @param resolvedTreatment the entry's own spelling of the treatment, as returned by the matcher
     */
    public Resolution resolve(GuidelineEntry entry, String resolvedTreatment, AlignmentVerdict verdict) {
        return resolve(entry, resolvedTreatment, verdict, Map.of());
    }

    /**
     * @param insights patient-facing notes keyed by normalized treatment name
     */
    public Resolution resolve(GuidelineEntry entry,
                              String resolvedTreatment,
                              AlignmentVerdict verdict,
                              Map<String, TreatmentInsight> insights) {
        List<String> risks = verdict.recognized()
                ? entry.riskProfile().getOrDefault(resolvedTreatment, List.of())
                : List.of();
        List<String> alternatives = verdict.recognized()
                ? entry.alternativeTreatments().getOrDefault(resolvedTreatment, List.of())
                : List.of();

        Optional<TreatmentInsight> insight = verdict.recognized()
                ? Optional.ofNullable(insights.get(TreatmentNormalizer.normalize(resolvedTreatment)))
                : Optional.empty();

        // Biomarker requirements belong to the stage, not to the treatment.
        return new Resolution(risks, alternatives, entry.requiredBiomarkers(), insight);
    }
}
