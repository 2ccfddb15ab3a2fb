package com.example.licensescanner.service.scoring;

/**
 * Everything the confidence score depends on.
 *
 * @param numberValidated    document number satisfied the resolved region's rule
 * @param regionConfirmed    region came from a printed header or a caller hint rather than inference
 * @param regionAmbiguous    region was inferred and several regions' rules accepted the document
 * @param personalFieldCount personal fields located through field codes (0 to 3)
 */
public record ScoringSignals(
        boolean numberValidated,
        boolean regionConfirmed,
        boolean regionAmbiguous,
        int personalFieldCount) {

    public ScoringSignals {
        if (personalFieldCount < 0) {
            throw new IllegalArgumentException("personalFieldCount must not be negative");
        }
    }

    public static ScoringSignals none() {
        return new ScoringSignals(false, false, false, 0);
    }
}
