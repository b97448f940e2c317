package com.mead.oncology.model;

import java.util.List;
import java.util.Objects;

/**
 * One consultation submission. Symptoms are informational and never change the verdict.
 */
public record ConsultationRequest(
        CancerType cancerType,
        String stage,
        String proposedTreatment,
        List<String> reportedSymptoms
) {

    public ConsultationRequest {
        reportedSymptoms = reportedSymptoms == null
                ? List.of()
                : reportedSymptoms.stream().filter(Objects::nonNull).toList();
    }

    public ConsultationRequest(CancerType cancerType, String stage, String proposedTreatment) {
        this(cancerType, stage, proposedTreatment, List.of());
    }
}
