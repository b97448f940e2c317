package com.mead.oncology.model;

/**
 * A common misconception about a treatment and the corrected statement.
 */
public record MythFact(
        String myth,
        String fact
) {
}
