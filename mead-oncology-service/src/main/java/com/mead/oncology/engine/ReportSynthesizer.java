package com.mead.oncology.engine;

import com.mead.oncology.model.AlignmentVerdict;
import com.mead.oncology.model.ConsultationRequest;
import com.mead.oncology.model.ConsultationResult;
import com.mead.oncology.model.CostEstimate;
import com.mead.oncology.model.GuidelineEntry;
import com.mead.oncology.model.GuidelineReference;
import com.mead.oncology.model.MythFact;
import com.mead.oncology.model.Resolution;
import com.mead.oncology.model.TreatmentInsight;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class ReportSynthesizer {

    public ConsultationResult synthesize(GuidelineEntry entry,
                                         AlignmentVerdict verdict,
                                         Resolution resolution,
                                         ConsultationRequest request,
                                         String knowledgeBaseVersion) {
        return synthesize(entry, verdict, resolution, request, knowledgeBaseVersion, List.of());
    }

    public ConsultationResult synthesize(GuidelineEntry entry,
                                         AlignmentVerdict verdict,
                                         Resolution resolution,
                                         ConsultationRequest request,
                                         String knowledgeBaseVersion,
                                         List<GuidelineReference> references) {
        Optional<CostEstimate> cost = verdict.recognized()
                ? Optional.ofNullable(entry.costEstimate().get(verdict.resolvedTreatment()))
                : Optional.empty();
        Optional<String> urgency = resolution.insight().map(TreatmentInsight::urgency);
        List<MythFact> myths = resolution.insight().map(TreatmentInsight::myths).orElse(List.of());
        String standardTreatment = entry.standardTreatmentText();

        return new ConsultationResult(
                entry.cancerType(),
                entry.cancerType().displayName(),
                entry.stage(),
                GuidelineVocabulary.stageLabel(entry.stage()),
                GuidelineVocabulary.stageDescription(entry.stage()),

                request.proposedTreatment(),
                verdict.resolvedTreatment(),
                verdict.alignment(),
                verdict.recognized(),
                verdict.rank(),
                GuidelineVocabulary.alignmentSummary(entry, verdict, request.proposedTreatment()),

                entry.recommendedTreatments(),
                standardTreatment,
                GuidelineVocabulary.simplifyTreatmentText(standardTreatment),
                resolution.requiredTests(),
                resolution.risks(),
                resolution.alternatives(),
                cost,
                entry.survivalStats(),
                urgency,
                myths,

                entry.guidelineSource(),
                entry.guidelineUrl(),
                references,
                entry.optionalEvidenceLevel(),
                GuidelineVocabulary.evidenceExplanation(entry.evidenceLevel()),
                entry.optionalRecoveryTime(),
                entry.contraindications(),
                entry.notes(),

                request.reportedSymptoms(),
                knowledgeBaseVersion
        );
    }
}
