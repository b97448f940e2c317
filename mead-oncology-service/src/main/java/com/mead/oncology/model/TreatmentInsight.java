package com.mead.oncology.model;

import java.util.List;

/**
 * Patient-facing notes on a treatment that hold whatever the cancer type or stage: how soon it usually
 * starts and the misconceptions patients commonly have about it.
 */
public record TreatmentInsight(
        String treatment,
        String urgency,
        List<MythFact> myths
) {

    public TreatmentInsight {
        myths = List.copyOf(myths);
    }
}
