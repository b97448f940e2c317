package com.mead.oncology.repository;

import com.mead.oncology.engine.TreatmentNormalizer;
import com.mead.oncology.exception.MalformedKnowledgeBaseException;
import com.mead.oncology.model.CostEstimate;
import com.mead.oncology.model.GuidelineEntry;
import com.mead.oncology.model.MoneyRange;
import com.mead.oncology.model.SurvivalStats;
import com.mead.oncology.model.TreatmentInsight;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Load-time checks the SHACL shapes cannot express: closed-world treatment references inside each entry,
 * stages valid for their cancer type, one entry per pair and ordered numeric ranges.
 */
@Component
public class KnowledgeBaseIntegrityChecker {

    public void check(String source, Collection<GuidelineEntry> entries, Map<String, String> synonyms) {
        check(source, entries, synonyms, List.of(), List.of());
    }

    /**
     * @param readViolations problems already found while reading the graph, reported together with the rest
     */
    public void check(String source,
                      Collection<GuidelineEntry> entries,
                      Map<String, String> synonyms,
                      Collection<TreatmentInsight> insights,
                      List<String> readViolations) {
        List<String> violations = new ArrayList<>(readViolations);
        Set<String> seenPairs = new HashSet<>();
        Set<String> allTreatments = new HashSet<>();

        for (GuidelineEntry entry : entries) {
            String label = entry.cancerType() + "/" + entry.stage();

            if (!entry.cancerType().isValidStage(entry.stage())) {
                violations.add(label + ": stage '" + entry.stage() + "' is not in the "
                        + entry.cancerType() + " staging scheme " + entry.cancerType().stages());
            }
            if (!seenPairs.add(label)) {
                violations.add(label + ": duplicate entry");
            }
            if (entry.recommendedTreatments().isEmpty()) {
                violations.add(label + ": no recommended treatments");
            }

            Set<String> universe = entry.treatmentUniverse();
            checkNoBlankOrDuplicate(label, universe, entry, violations);
            allTreatments.addAll(universe.stream().map(TreatmentNormalizer::normalize).collect(Collectors.toSet()));

            checkKeys(label, "riskProfile", entry.riskProfile().keySet(), universe, violations);
            checkKeys(label, "costEstimate", entry.costEstimate().keySet(), universe, violations);
            checkKeys(label, "alternativeTreatments", entry.alternativeTreatments().keySet(), universe, violations);
            entry.alternativeTreatments().forEach((treatment, substitutes) -> {
                for (String substitute : substitutes) {
                    if (!universe.contains(substitute)) {
                        violations.add(label + ": alternative '" + substitute + "' for '" + treatment
                                + "' is not a treatment of this entry");
                    }
                }
            });

            entry.costEstimate().forEach((treatment, cost) -> checkCost(label, treatment, cost, violations));
            checkSurvival(label, entry.survivalStats(), violations);
        }

        synonyms.forEach((alias, canonical) -> {
            if (!allTreatments.contains(TreatmentNormalizer.normalize(canonical))) {
                violations.add("synonym '" + alias + "' points to unknown treatment '" + canonical + "'");
            }
        });

        Set<String> seenInsights = new HashSet<>();
        for (TreatmentInsight insight : insights) {
            String key = TreatmentNormalizer.normalize(insight.treatment());
            if (!allTreatments.contains(key)) {
                violations.add("treatment insight for unknown treatment '" + insight.treatment() + "'");
            }
            if (!seenInsights.add(key)) {
                violations.add("treatment insight for '" + insight.treatment() + "' is declared more than once");
            }
        }

        if (!violations.isEmpty()) {
            throw new MalformedKnowledgeBaseException(source, violations);
        }
    }

    private static void checkNoBlankOrDuplicate(String label, Set<String> universe, GuidelineEntry entry,
                                                List<String> violations) {
        if (universe.stream().anyMatch(String::isBlank)) {
            violations.add(label + ": blank treatment name");
        }
        int declared = entry.recommendedTreatments().size() + entry.knownTreatments().size();
        if (declared != universe.size()) {
            violations.add(label + ": treatment listed more than once");
        }
        Set<String> normalized = universe.stream().map(TreatmentNormalizer::normalize).collect(Collectors.toSet());
        if (normalized.size() != universe.size()) {
            violations.add(label + ": treatment names differ only by case or spacing");
        }
    }

    private static void checkKeys(String label, String table, Set<String> keys, Set<String> universe,
                                  List<String> violations) {
        for (String key : keys) {
            if (!universe.contains(key)) {
                violations.add(label + ": " + table + " references '" + key + "' which is not a treatment of this entry");
            }
        }
    }

    private static void checkCost(String label, String treatment, CostEstimate cost, List<String> violations) {
        for (MoneyRange range : List.of(cost.inr(), cost.usd())) {
            if (range.min() < 0 || range.min() > range.max()) {
                violations.add(label + ": invalid " + range.currency() + " cost range for '" + treatment + "'");
            }
        }
    }

    private static void checkSurvival(String label, SurvivalStats stats, List<String> violations) {
        if (stats.low() > stats.high()) {
            violations.add(label + ": survival range low exceeds high");
        }
    }
}
