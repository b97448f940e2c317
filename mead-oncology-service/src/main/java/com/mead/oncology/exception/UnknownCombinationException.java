package com.mead.oncology.exception;

import com.mead.oncology.model.CancerType;
import lombok.Getter;

/**
 * No curated guideline entry exists for the requested cancer type and stage. Expected and recoverable.
 */
@Getter
public class UnknownCombinationException extends IllegalArgumentException {

    private final CancerType cancerType;
    private final String stage;

    public UnknownCombinationException(CancerType cancerType, String stage) {
        super(message(cancerType, stage));
        this.cancerType = cancerType;
        this.stage = stage;
    }

    private static String message(CancerType cancerType, String stage) {
        if (!cancerType.isValidStage(stage)) {
            return "Stage '" + stage + "' is not part of the " + cancerType.displayName()
                    + " staging scheme " + cancerType.stages();
        }
        return "Guidelines are not currently available for " + cancerType.displayName() + " stage " + stage;
    }
}
