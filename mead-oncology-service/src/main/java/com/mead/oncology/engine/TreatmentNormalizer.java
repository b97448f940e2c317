package com.mead.oncology.engine;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical form used for every treatment-name comparison: NFKC, trimmed, single spaces, lower case.
 * Two spellings that differ only in case or whitespace always normalize to the same string.
 */
public final class TreatmentNormalizer {

    public static String normalize(String treatment) {
        if (treatment == null) return "";
        String compatible = Normalizer.normalize(treatment, Normalizer.Form.NFKC);
        return compatible.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Applies the synonym table to an already normalized name. Names without a synonym come back unchanged.
     */
    public static String resolveSynonym(String normalized, Map<String, String> synonyms) {
        String canonical = synonyms.get(normalized);
        return canonical == null ? normalized : normalize(canonical);
    }

    private TreatmentNormalizer() {}
}
