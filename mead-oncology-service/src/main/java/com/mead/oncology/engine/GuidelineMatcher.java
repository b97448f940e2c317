package com.mead.oncology.engine;

import com.mead.oncology.model.Alignment;
import com.mead.oncology.model.AlignmentVerdict;
import com.mead.oncology.model.GuidelineEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Stream;

/**
 * Compares a proposed treatment with one guideline entry. Rank in the recommended list decides:
 * first place is aligned, any other place partially aligned; everything else is not aligned.
 */
@Component
public class GuidelineMatcher {

    public AlignmentVerdict evaluate(GuidelineEntry entry, String proposedTreatment) {
        return evaluate(entry, proposedTreatment, Map.of());
    }

    public AlignmentVerdict evaluate(GuidelineEntry entry, String proposedTreatment, Map<String, String> synonyms) {
        String normalized = TreatmentNormalizer.normalize(proposedTreatment);

        AlignmentVerdict verdict = match(entry, normalized);
        if (verdict.recognized()) return verdict;

        // Exact match failed; retry once through the synonym table.
        String viaSynonym = TreatmentNormalizer.resolveSynonym(normalized, synonyms);
        if (!viaSynonym.equals(normalized)) {
            AlignmentVerdict synonymVerdict = match(entry, viaSynonym);
            if (synonymVerdict.recognized()) return synonymVerdict;
        }
        return verdict;
    }

    private static AlignmentVerdict match(GuidelineEntry entry, String normalized) {
        List<String> recommended = entry.recommendedTreatments();
        for (int i = 0; i < recommended.size(); i++) {
            if (TreatmentNormalizer.normalize(recommended.get(i)).equals(normalized)) {
                Alignment alignment = i == 0 ? Alignment.ALIGNED : Alignment.PARTIALLY_ALIGNED;
                return new AlignmentVerdict(alignment, true, recommended.get(i), OptionalInt.of(i + 1));
            }
        }

        Optional<String> known = Stream.of(
                        entry.knownTreatments().stream(),
                        entry.riskProfile().keySet().stream(),
                        entry.costEstimate().keySet().stream(),
                        entry.alternativeTreatments().keySet().stream())
                .flatMap(names -> names)
                .filter(name -> TreatmentNormalizer.normalize(name).equals(normalized))
                .findFirst();

        return known
                .map(name -> new AlignmentVerdict(Alignment.NOT_ALIGNED, true, name, OptionalInt.empty()))
                .orElseGet(() -> new AlignmentVerdict(Alignment.NOT_ALIGNED, false, normalized, OptionalInt.empty()));
    }
}
