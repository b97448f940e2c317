package com.mead.oncology.model;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable outcome of one consultation. Every component carries a value; absent data is an empty
 * {@link Optional} or an empty list, never {@code null}.
 */
public record ConsultationResult(
        CancerType cancerType,
        String cancerTypeName,
        String stage,
        String stageLabel,
        String stageDescription,

        String proposedTreatment,
        String resolvedTreatment,
        Alignment alignment,
        boolean treatmentRecognized,
        OptionalInt recommendationRank,
        String alignmentSummary,

        List<String> matchedGuidelineTreatments,
        String standardTreatment,
        String standardTreatmentSimple,
        List<String> requiredTests,
        List<String> risks,
        List<String> alternatives,
        Optional<CostEstimate> costEstimate,
        SurvivalStats survivalStats,
        Optional<String> urgency,
        List<MythFact> myths,

        String guidelineSource,
        String guidelineUrl,
        List<GuidelineReference> guidelineReferences,
        Optional<String> evidenceLevel,
        String evidenceExplanation,
        Optional<String> recoveryTime,
        List<String> contraindications,
        List<String> notes,

        List<String> reportedSymptoms,
        String knowledgeBaseVersion
) {

    public ConsultationResult {
        matchedGuidelineTreatments = List.copyOf(matchedGuidelineTreatments);
        requiredTests = List.copyOf(requiredTests);
        risks = List.copyOf(risks);
        alternatives = List.copyOf(alternatives);
        myths = List.copyOf(myths);
        guidelineReferences = List.copyOf(guidelineReferences);
        contraindications = List.copyOf(contraindications);
        notes = List.copyOf(notes);
        reportedSymptoms = List.copyOf(reportedSymptoms);
    }
}
