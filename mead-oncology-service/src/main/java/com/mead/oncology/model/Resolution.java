package com.mead.oncology.model;

import java.util.List;
import java.util.Optional;

public record Resolution(
        List<String> risks,
        List<String> alternatives,
        List<String> requiredTests,
        Optional<TreatmentInsight> insight
) {

    public Resolution {
        risks = List.copyOf(risks);
        alternatives = List.copyOf(alternatives);
        requiredTests = List.copyOf(requiredTests);
    }
}
