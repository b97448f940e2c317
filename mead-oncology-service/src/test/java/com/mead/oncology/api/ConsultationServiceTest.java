package com.mead.oncology.api;

import com.mead.oncology.GuidelineFixtures;
import com.mead.oncology.dto.GuidelineDtos.CancerTypeSummary;
import com.mead.oncology.dto.GuidelineDtos.GuidelineDetail;
import com.mead.oncology.engine.GuidelineMatcher;
import com.mead.oncology.engine.ReportSynthesizer;
import com.mead.oncology.engine.RiskAlternativeResolver;
import com.mead.oncology.exception.InvalidInputException;
import com.mead.oncology.exception.UnknownCombinationException;
import com.mead.oncology.model.Alignment;
import com.mead.oncology.model.CancerType;
import com.mead.oncology.model.ConsultationResult;
import com.mead.oncology.model.KnowledgeBase;
import com.mead.oncology.model.GuidelineEntry;
import com.mead.oncology.rdf.GuidelineGraphLoader;
import com.mead.oncology.repository.GuidelineRepository;
import com.mead.oncology.repository.KnowledgeBaseIntegrityChecker;
import com.mead.oncology.service.ConsultationRequestValidator;
import com.mead.oncology.service.ConsultationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConsultationServiceTest {

    private GuidelineRepository repo;
    private ConsultationService service;

    @BeforeEach
    void setUp() {
        repo = mock(GuidelineRepository.class);
        KnowledgeBase kb = GuidelineFixtures.knowledgeBase(
                GuidelineFixtures.breastStageII(),
                GuidelineFixtures.lungStageIV(),
                GuidelineFixtures.prostateLowRisk());
        when(repo.snapshot()).thenReturn(kb);

        service = new ConsultationService(repo, new ConsultationRequestValidator(), new GuidelineMatcher(),
                new RiskAlternativeResolver(), new ReportSynthesizer());
    }

    @Test
    void breastStageIIChemotherapy_isAligned_withRisksAlternativesAndCost() {
        ConsultationResult result = service.runConsultation("Breast", "II", "Chemotherapy", List.of());

        assertThat(result.alignment()).isEqualTo(Alignment.ALIGNED);
        assertThat(result.risks()).contains("Nausea", "Hair loss");
        assertThat(result.alternatives()).containsExactly("Surgery");
        assertThat(result.costEstimate()).isPresent();
        assertThat(result.requiredTests()).contains("HER2");
        assertThat(result.knowledgeBaseVersion()).isEqualTo("test-version");
    }

    @Test
    void lungStageIVUnlistedDrug_isNotAligned_withoutInventedData() {
        ConsultationResult result = service.runConsultation("LUNG_NSCLC", "IV", "UnlistedDrugX", List.of());

        assertThat(result.alignment()).isEqualTo(Alignment.NOT_ALIGNED);
        assertThat(result.treatmentRecognized()).isFalse();
        assertThat(result.risks()).isEmpty();
        assertThat(result.alternatives()).isEmpty();
        assertThat(result.costEstimate()).isEmpty();
        assertThat(result.requiredTests()).containsExactly("EGFR", "ALK", "PD-L1");
    }

    @Test
    void prostateLowRiskAdt_isNotAligned_butRecognizedWithCuratedData() {
        ConsultationResult result = service.runConsultation("Prostate", "low risk", "ADT", List.of());

        assertThat(result.stage()).isEqualTo("LowRisk");
        assertThat(result.alignment()).isEqualTo(Alignment.NOT_ALIGNED);
        assertThat(result.treatmentRecognized()).isTrue();
        assertThat(result.resolvedTreatment()).isEqualTo("Androgen deprivation therapy");
        assertThat(result.risks()).containsExactly("Hot flashes", "Bone loss");
        assertThat(result.alternatives()).containsExactly("Active surveillance", "Radiation therapy");
    }

    @Test
    void stageOutsideScheme_throwsUnknownCombination() {
        assertThatThrownBy(() -> service.runConsultation("Colorectal", "VII", "Surgical resection", List.of()))
                .isInstanceOf(UnknownCombinationException.class)
                .hasMessageContaining("'VII'");
    }

    @Test
    void validStageWithoutEntry_throwsUnknownCombination() {
        assertThatThrownBy(() -> service.runConsultation("Breast", "IV", "Chemotherapy", List.of()))
                .isInstanceOf(UnknownCombinationException.class)
                .hasMessageContaining("not currently available");
    }

    @Test
    void unsupportedCancerType_throwsInvalidInput() {
        assertThatThrownBy(() -> service.runConsultation("Pancreatic", "II", "Chemotherapy", List.of()))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(repo);
    }

    @Test
    void symptomsNeverChangeTheVerdict() {
        ConsultationResult without = service.runConsultation("Breast", "II", "Surgery", List.of());
        ConsultationResult with = service.runConsultation("Breast", "II", "Surgery",
                List.of("severe pain", "fatigue", "weight loss"));

        assertThat(with.alignment()).isEqualTo(without.alignment());
        assertThat(with.risks()).isEqualTo(without.risks());
        assertThat(with.alternatives()).isEqualTo(without.alternatives());
        assertThat(with.reportedSymptoms()).hasSize(3);
    }

    @Test
    void repeatedConsultations_areIdentical() {
        ConsultationResult first = service.runConsultation("Breast", "II", "Hormonal therapy", List.of("fatigue"));
        ConsultationResult second = service.runConsultation("Breast", "II", "Hormonal therapy", List.of("fatigue"));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void everyCuratedPairAndTreatment_producesAResult() {
        KnowledgeBase kb = repo.snapshot();
        for (var entry : kb.allEntries()) {
            for (String treatment : entry.treatmentUniverse()) {
                ConsultationResult result = service.runConsultation(
                        entry.cancerType().name(), entry.stage(), treatment, List.of());

                assertThat(result.treatmentRecognized()).isTrue();
                assertThat(result.resolvedTreatment()).isEqualTo(treatment);
            }
        }
    }

    @Test
    void shippedKnowledgeBase_everyPairAndTreatment_fillsEveryResultField() throws Exception {
        KnowledgeBase shipped = new GuidelineRepository(
                new GuidelineGraphLoader(new ClassPathResource("rdf/oncology-guidelines.ttl"),
                        new ClassPathResource("shacl/guideline-entry-shapes.ttl")),
                new KnowledgeBaseIntegrityChecker()).refresh();
        when(repo.snapshot()).thenReturn(shipped);

        int consultations = 0;
        for (GuidelineEntry entry : shipped.allEntries()) {
            List<String> treatments = new ArrayList<>(entry.treatmentUniverse());
            treatments.add("UnlistedDrugX");
            for (String treatment : treatments) {
                ConsultationResult result = service.runConsultation(
                        entry.cancerType().name(), entry.stage(), treatment, List.of());

                for (RecordComponent component : ConsultationResult.class.getRecordComponents()) {
                    assertThat(component.getAccessor().invoke(result))
                            .as("%s for %s/%s '%s'", component.getName(), entry.cancerType(), entry.stage(), treatment)
                            .isNotNull();
                }
                assertThat(result.standardTreatment()).isNotBlank();
                assertThat(result.standardTreatmentSimple()).isNotBlank();
                assertThat(result.guidelineReferences()).hasSize(4);
                if (!result.treatmentRecognized()) {
                    assertThat(result.costEstimate()).isEmpty();
                    assertThat(result.urgency()).isEmpty();
                    assertThat(result.myths()).isEmpty();
                }
                consultations++;
            }
        }
        assertThat(consultations).isGreaterThan(shipped.size());
    }

    @Test
    void shippedKnowledgeBase_surfacesUrgencyAndMythsForCommonTreatments() {
        KnowledgeBase shipped = new GuidelineRepository(
                new GuidelineGraphLoader(new ClassPathResource("rdf/oncology-guidelines.ttl"),
                        new ClassPathResource("shacl/guideline-entry-shapes.ttl")),
                new KnowledgeBaseIntegrityChecker()).refresh();
        when(repo.snapshot()).thenReturn(shipped);

        ConsultationResult result = service.runConsultation("Prostate", "low risk", "watchful monitoring", List.of());

        assertThat(result.resolvedTreatment()).isEqualTo("Active surveillance");
        assertThat(result.urgency()).hasValueSatisfying(urgency -> assertThat(urgency).startsWith("Low"));
        assertThat(result.myths()).hasSize(2);
        assertThat(result.standardTreatmentSimple()).contains("slow-growing");
    }

    @Test
    void listCancerTypes_reportsCuratedStagesPerScheme() {
        List<CancerTypeSummary> summaries = service.listCancerTypes();

        assertThat(summaries).hasSize(CancerType.values().length);
        assertThat(summaries.get(0).id()).isEqualTo("BREAST");
        assertThat(summaries.get(0).curatedStages()).containsExactly("II");
        assertThat(summaries.get(2).curatedStages()).isEmpty();
    }

    @Test
    void getGuideline_acceptsFreeFormStage() {
        GuidelineDetail detail = service.getGuideline("lung", "stage 4");

        assertThat(detail.cancerType()).isEqualTo("LUNG_NSCLC");
        assertThat(detail.stage()).isEqualTo("IV");
        assertThat(detail.recommendedTreatments()).startsWith("Osimertinib");
        assertThat(detail.standardTreatment()).isEqualTo("Osimertinib or Immunotherapy or Chemotherapy");
        assertThat(detail.standardTreatmentSimple()).contains("immune system treatment");
    }
}
