package com.mead.oncology.service;

import com.mead.oncology.dto.GuidelineDtos.CancerTypeSummary;
import com.mead.oncology.dto.GuidelineDtos.GuidelineDetail;
import com.mead.oncology.engine.GuidelineMatcher;
import com.mead.oncology.engine.GuidelineVocabulary;
import com.mead.oncology.engine.ReportSynthesizer;
import com.mead.oncology.engine.RiskAlternativeResolver;
import com.mead.oncology.model.AlignmentVerdict;
import com.mead.oncology.model.CancerType;
import com.mead.oncology.model.ConsultationRequest;
import com.mead.oncology.model.ConsultationResult;
import com.mead.oncology.model.GuidelineEntry;
import com.mead.oncology.model.KnowledgeBase;
import com.mead.oncology.model.Resolution;
import com.mead.oncology.repository.GuidelineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Entry point of the guideline engine. Each consultation reads one knowledge base snapshot and runs
 * matcher, resolver and synthesizer against it; nothing is shared between consultations.
 */
@Service
public class ConsultationService {

    private static final Logger log = LoggerFactory.getLogger(ConsultationService.class);

    private final GuidelineRepository repo;
    private final ConsultationRequestValidator validator;
    private final GuidelineMatcher matcher;
    private final RiskAlternativeResolver resolver;
    private final ReportSynthesizer synthesizer;

    public ConsultationService(GuidelineRepository repo,
                               ConsultationRequestValidator validator,
                               GuidelineMatcher matcher,
                               RiskAlternativeResolver resolver,
                               ReportSynthesizer synthesizer) {
        this.repo = repo;
        this.validator = validator;
        this.matcher = matcher;
        this.resolver = resolver;
        this.synthesizer = synthesizer;
    }

    /**
     * @throws com.mead.oncology.exception.InvalidInputException       for an unsupported cancer type or empty input
     * @throws com.mead.oncology.exception.UnknownCombinationException when no guideline entry covers the stage
     */
    public ConsultationResult runConsultation(String cancerType, String stage, String proposedTreatment,
                                              List<String> symptoms) {
        return runConsultation(new ConsultationRequest(
                validator.parseCancerType(cancerType), stage, proposedTreatment, symptoms));
    }

    public ConsultationResult runConsultation(ConsultationRequest request) {
        return runConsultation(repo.snapshot(), request);
    }

    ConsultationResult runConsultation(KnowledgeBase kb, ConsultationRequest request) {
        validator.validate(request);

        CancerType cancerType = request.cancerType();
        String stage = cancerType.canonicalStage(request.stage());
        GuidelineEntry entry = kb.lookup(cancerType, stage);

        AlignmentVerdict verdict = matcher.evaluate(entry, request.proposedTreatment(), kb.getSynonyms());
        Resolution resolution = resolver.resolve(entry, verdict.resolvedTreatment(), verdict, kb.getInsights());
        ConsultationResult result = synthesizer.synthesize(entry, verdict, resolution, request, kb.getVersion(),
                kb.getReferences());

        log.debug("Consultation {}/{} treatment '{}' -> {} (recognized={})",
                cancerType, stage, verdict.resolvedTreatment(), verdict.alignment(), verdict.recognized());
        return result;
    }

    public List<CancerTypeSummary> listCancerTypes() {
        KnowledgeBase kb = repo.snapshot();
        return Arrays.stream(CancerType.values())
                .map(type -> new CancerTypeSummary(type.name(), type.displayName(), type.stages(), kb.curatedStages(type)))
                .toList();
    }

    public GuidelineDetail getGuideline(String cancerType, String stage) {
        CancerType type = validator.parseCancerType(cancerType);
        String canonicalStage = type.canonicalStage(stage);
        GuidelineEntry entry = repo.snapshot().lookup(type, canonicalStage);
        return new GuidelineDetail(
                entry.cancerType().name(),
                entry.cancerType().displayName(),
                entry.stage(),
                GuidelineVocabulary.stageLabel(entry.stage()),
                entry.guidelineSource(),
                entry.guidelineUrl(),
                entry.evidenceLevel(),
                entry.standardTreatmentText(),
                GuidelineVocabulary.simplifyTreatmentText(entry.standardTreatmentText()),
                entry.recommendedTreatments(),
                entry.knownTreatments(),
                entry.requiredBiomarkers(),
                entry.survivalStats(),
                entry.riskProfile(),
                entry.costEstimate(),
                entry.alternativeTreatments(),
                entry.contraindications(),
                entry.notes()
        );
    }
}
