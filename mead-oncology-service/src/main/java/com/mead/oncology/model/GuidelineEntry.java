package com.mead.oncology.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Curated guideline record for one (cancer type, stage) pair.
 * <p>
 * The treatment universe of an entry is its recommended treatments plus the treatments it merely
 * recognizes ({@code knownTreatments}). Risk, cost and alternative tables may only name treatments of
 * that universe; the knowledge base loader refuses entries that break this.
 */
public record GuidelineEntry(
        CancerType cancerType,
        String stage,
        String guidelineSource,
        String guidelineUrl,
        String evidenceLevel,
        String recoveryTime,
        String standardTreatment,
        List<String> recommendedTreatments,
        List<String> knownTreatments,
        List<String> requiredBiomarkers,
        SurvivalStats survivalStats,
        Map<String, List<String>> riskProfile,
        Map<String, CostEstimate> costEstimate,
        Map<String, List<String>> alternativeTreatments,
        List<String> contraindications,
        List<String> notes
) {

    public GuidelineEntry {
        recommendedTreatments = List.copyOf(recommendedTreatments);
        knownTreatments = List.copyOf(knownTreatments);
        requiredBiomarkers = List.copyOf(new LinkedHashSet<>(requiredBiomarkers));
        riskProfile = copyOfLists(riskProfile);
        costEstimate = Collections.unmodifiableMap(new LinkedHashMap<>(costEstimate));
        alternativeTreatments = copyOfLists(alternativeTreatments);
        contraindications = List.copyOf(contraindications);
        notes = List.copyOf(notes);
    }

    public Set<String> treatmentUniverse() {
        Set<String> universe = new LinkedHashSet<>(recommendedTreatments);
        universe.addAll(knownTreatments);
        return Collections.unmodifiableSet(universe);
    }

    public Optional<String> optionalEvidenceLevel() {
        return Optional.ofNullable(evidenceLevel).filter(level -> !level.isBlank());
    }

    public Optional<String> optionalRecoveryTime() {
        return Optional.ofNullable(recoveryTime).filter(time -> !time.isBlank());
    }

    /**
     * The guideline's own wording of the standard plan, or the recommended treatments in order when the
     * entry does not quote one.
     */
    public String standardTreatmentText() {
        if (standardTreatment != null && !standardTreatment.isBlank()) return standardTreatment;
        return String.join(" or ", recommendedTreatments);
    }

    private static Map<String, List<String>> copyOfLists(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((treatment, values) -> copy.put(treatment, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
