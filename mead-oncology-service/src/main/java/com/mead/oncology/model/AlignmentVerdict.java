package com.mead.oncology.model;

import java.util.OptionalInt;

/**
 * Outcome of matching a proposed treatment against one guideline entry.
 *
 * @param recognized        false when the entry has no data at all on the treatment
 * @param resolvedTreatment the entry's own spelling when recognized, otherwise the normalized input
 * @param rank              1-based position in the recommended list, empty when not recommended
 */
public record AlignmentVerdict(
        Alignment alignment,
        boolean recognized,
        String resolvedTreatment,
        OptionalInt rank
) {
}
