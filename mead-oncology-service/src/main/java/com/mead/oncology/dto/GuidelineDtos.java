package com.mead.oncology.dto;

import com.mead.oncology.model.CostEstimate;
import com.mead.oncology.model.SurvivalStats;

import java.util.List;
import java.util.Map;

public final class GuidelineDtos {

    public record ConsultationRequestBody(
            String cancerType,
            String stage,
            String proposedTreatment,
            List<String> symptoms
    ) {}

    public record CancerTypeSummary(
            String id,
            String name,
            List<String> stagingScheme,
            List<String> curatedStages
    ) {}

    public record GuidelineDetail(
            String cancerType,
            String cancerTypeName,
            String stage,
            String stageLabel,
            String guidelineSource,
            String guidelineUrl,
            String evidenceLevel,
            String standardTreatment,
            String standardTreatmentSimple,
            List<String> recommendedTreatments,
            List<String> knownTreatments,
            List<String> requiredBiomarkers,
            SurvivalStats survivalStats,
            Map<String, List<String>> riskProfile,
            Map<String, CostEstimate> costEstimate,
            Map<String, List<String>> alternativeTreatments,
            List<String> contraindications,
            List<String> notes
    ) {}

    public record ErrorResponse(
            String error,
            String field,
            String message
    ) {}

    private GuidelineDtos() {}
}
