package com.mead.oncology.service;

import com.mead.oncology.exception.InvalidInputException;
import com.mead.oncology.model.CancerType;
import com.mead.oncology.model.ConsultationRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Rejects consultation input before it reaches the matcher. Stage membership in the staging scheme is
 * not checked here: a stage outside the scheme is an unknown combination, reported by the knowledge base.
 */
@Component
public class ConsultationRequestValidator {

    static final int MAX_TREATMENT_LENGTH = 200;
    static final int MAX_SYMPTOMS = 50;
    static final int MAX_SYMPTOM_LENGTH = 500;

    private static final List<String> KEYBOARD_ROWS = List.of("qwertyuiop", "asdfghjkl", "zxcvbnm");
    private static final int KEYBOARD_RUN = 4;
    private static final int MIN_CHECKED_WORD_LENGTH = 5;
    private static final double MIN_CHAR_DIVERSITY = 0.4;

    public CancerType parseCancerType(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidInputException("cancerType", "Cancer type is required");
        }
        return CancerType.fromLabel(label).orElseThrow(() -> new InvalidInputException("cancerType",
                "Unsupported cancer type '" + label.strip() + "'. Supported: " + Arrays.toString(CancerType.values())));
    }

    public void validate(ConsultationRequest request) {
        if (request.cancerType() == null) {
            throw new InvalidInputException("cancerType", "Cancer type is required");
        }
        if (request.stage() == null || request.stage().isBlank()) {
            throw new InvalidInputException("stage", "Stage is required");
        }

        String treatment = request.proposedTreatment();
        if (treatment == null || treatment.isBlank()) {
            throw new InvalidInputException("proposedTreatment", "Proposed treatment must not be empty");
        }
        if (treatment.strip().length() > MAX_TREATMENT_LENGTH) {
            throw new InvalidInputException("proposedTreatment",
                    "Proposed treatment is longer than " + MAX_TREATMENT_LENGTH + " characters");
        }
        if (looksLikeGibberish(treatment)) {
            throw new InvalidInputException("proposedTreatment",
                    "Proposed treatment does not look like a treatment name: '" + treatment.strip() + "'");
        }

        List<String> symptoms = request.reportedSymptoms();
        if (symptoms.size() > MAX_SYMPTOMS) {
            throw new InvalidInputException("symptoms", "At most " + MAX_SYMPTOMS + " symptoms may be reported");
        }
        if (symptoms.stream().anyMatch(symptom -> symptom.length() > MAX_SYMPTOM_LENGTH)) {
            throw new InvalidInputException("symptoms",
                    "Each symptom must be at most " + MAX_SYMPTOM_LENGTH + " characters");
        }
    }

    /**
     * True when more than half of the words are keyboard mashing: long words with few distinct characters
     * or containing a run of adjacent keys ("asdf", "lkjh").
     */
    static boolean looksLikeGibberish(String text) {
        String[] words = text.strip().toLowerCase(Locale.ROOT).split("\\s+");
        if (words.length == 0) return false;

        int gibberish = 0;
        for (String word : words) {
            if (word.length() < MIN_CHECKED_WORD_LENGTH) continue;
            long distinct = word.chars().distinct().count();
            if ((double) distinct / word.length() < MIN_CHAR_DIVERSITY || hasKeyboardRun(word)) {
                gibberish++;
            }
        }
        return (double) gibberish / words.length > 0.5;
    }

    private static boolean hasKeyboardRun(String word) {
        List<String> runs = new ArrayList<>();
        for (String row : KEYBOARD_ROWS) {
            for (int i = 0; i + KEYBOARD_RUN <= row.length(); i++) {
                String run = row.substring(i, i + KEYBOARD_RUN);
                runs.add(run);
                runs.add(new StringBuilder(run).reverse().toString());
            }
        }
        return runs.stream().anyMatch(word::contains);
    }
}
