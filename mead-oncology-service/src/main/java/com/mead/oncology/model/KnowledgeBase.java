package com.mead.oncology.model;

import com.mead.oncology.engine.TreatmentNormalizer;
import com.mead.oncology.exception.UnknownCombinationException;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the guideline knowledge base. A reload builds a new snapshot; nothing in here
 * is ever modified after construction, so any number of threads may read it.
 */
@Getter
public final class KnowledgeBase {

    private final String version;
    private final String source;
    private final Instant loadedAt;

    /** Normalized alias to canonical treatment name. */
    private final Map<String, String> synonyms;

    /** Normalized treatment name to its patient-facing notes. */
    private final Map<String, TreatmentInsight> insights;

    private final List<GuidelineReference> references;

    @Getter(AccessLevel.NONE)
    private final Map<CancerType, Map<String, GuidelineEntry>> entries;

    public KnowledgeBase(String version,
                         String source,
                         Instant loadedAt,
                         Collection<GuidelineEntry> guidelineEntries,
                         Map<String, String> synonyms,
                         Collection<TreatmentInsight> treatmentInsights,
                         List<GuidelineReference> references) {
        this.version = version;
        this.source = source;
        this.loadedAt = loadedAt;
        this.synonyms = Collections.unmodifiableMap(new LinkedHashMap<>(synonyms));
        this.references = List.copyOf(references);

        Map<String, TreatmentInsight> byTreatment = new LinkedHashMap<>();
        for (TreatmentInsight insight : treatmentInsights) {
            byTreatment.put(TreatmentNormalizer.normalize(insight.treatment()), insight);
        }
        this.insights = Collections.unmodifiableMap(byTreatment);

        Map<CancerType, Map<String, GuidelineEntry>> byType = new EnumMap<>(CancerType.class);
        for (GuidelineEntry entry : guidelineEntries) {
            byType.computeIfAbsent(entry.cancerType(), type -> new LinkedHashMap<>())
                    .put(entry.stage(), entry);
        }
        byType.replaceAll((type, byStage) -> Collections.unmodifiableMap(byStage));
        this.entries = Collections.unmodifiableMap(byType);
    }

    public Optional<GuidelineEntry> find(CancerType cancerType, String stage) {
        return Optional.ofNullable(entries.getOrDefault(cancerType, Map.of()).get(stage));
    }

    /**
     * @throws UnknownCombinationException when no curated entry exists for the pair
     */
    public GuidelineEntry lookup(CancerType cancerType, String stage) {
        return find(cancerType, stage)
                .orElseThrow(() -> new UnknownCombinationException(cancerType, stage));
    }

    /**
     * Stages of the given cancer type that have a curated entry, in the order of its staging scheme.
     */
    public List<String> curatedStages(CancerType cancerType) {
        Map<String, GuidelineEntry> byStage = entries.getOrDefault(cancerType, Map.of());
        return cancerType.stages().stream()
                .filter(byStage::containsKey)
                .toList();
    }

    public List<GuidelineEntry> allEntries() {
        return entries.values().stream()
                .flatMap(byStage -> byStage.values().stream())
                .toList();
    }

    public int size() {
        return entries.values().stream().mapToInt(Map::size).sum();
    }
}
