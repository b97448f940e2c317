package com.mead.oncology.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Cancer types covered by the guideline knowledge base, each with its own staging scheme.
 */
public enum CancerType {

    BREAST("Breast Cancer",
            List.of("0", "I", "II", "III", "IV"),
            List.of("breast", "breast cancer")),

    LUNG_NSCLC("Non-Small Cell Lung Cancer (NSCLC)",
            List.of("0", "I", "II", "III", "IV"),
            List.of("lung", "lung cancer", "nsclc", "lung/nsclc", "lung nsclc")),

    COLORECTAL("Colorectal Cancer",
            List.of("0", "I", "II", "III", "IV"),
            List.of("colorectal", "colorectal cancer", "colon", "rectal")),

    PROSTATE("Prostate Cancer",
            List.of("LowRisk", "IntermediateRisk", "HighRisk", "Metastatic"),
            List.of("prostate", "prostate cancer"));

    private static final List<String> ROMAN_STAGES = List.of("0", "I", "II", "III", "IV");

    private final String displayName;
    private final List<String> stages;
    private final List<String> aliases;

    CancerType(String displayName, List<String> stages, List<String> aliases) {
        this.displayName = displayName;
        this.stages = stages;
        this.aliases = aliases;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Stage tokens of this cancer type's staging scheme, in clinical order.
     */
    public List<String> stages() {
        return stages;
    }

    public boolean isValidStage(String stage) {
        return stage != null && stages.contains(stage);
    }

    /**
     * Maps a free-form stage ("stage 2", "ii", "low_risk") to the canonical token of this scheme.
     * Input that does not match any token of the scheme is returned trimmed but otherwise unchanged.
     */
    public String canonicalStage(String rawStage) {
        if (rawStage == null) return null;
        String trimmed = rawStage.trim();
        String key = stageKey(trimmed);
        if (key.startsWith("STAGE") && key.length() > "STAGE".length()) {
            key = key.substring("STAGE".length());
        }
        if (key.length() == 1 && Character.isDigit(key.charAt(0))) {
            int index = key.charAt(0) - '0';
            if (index < ROMAN_STAGES.size()) key = ROMAN_STAGES.get(index);
        }
        for (String stage : stages) {
            if (stageKey(stage).equals(key)) return stage;
        }
        return trimmed;
    }

    /**
     * Resolves a cancer type from its enum name or one of its aliases, ignoring case and surrounding blanks.
     */
    public static Optional<CancerType> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        String normalized = label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        for (CancerType type : values()) {
            if (type.name().toLowerCase(Locale.ROOT).equals(normalized)
                    || type.displayName.toLowerCase(Locale.ROOT).equals(normalized)
                    || type.aliases.contains(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static String stageKey(String value) {
        return value.replaceAll("[\\s_\\-]+", "").toUpperCase(Locale.ROOT);
    }
}
