package com.example.licensescanner.service.extraction;

import java.time.LocalDate;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Structured fields extracted from one document. A {@code null} component means the field could not
 * be extracted; that is a valid outcome, not an error.
 *
 * @param documentNumber  document number, upper-cased
 * @param regionCode      two-letter issuing region code
 * @param givenName       given name as printed
 * @param familyName      family name as printed
 * @param dateOfBirth     date of birth
 * @param confidence      extraction confidence in {@code [0, 1]}
 * @param regionEvidence  how the region was established
 * @param numberValidated whether {@code documentNumber} satisfies the rule of {@code regionCode}
 */
public record ExtractedFields(
        String documentNumber,
        String regionCode,
        String givenName,
        String familyName,
        LocalDate dateOfBirth,
        double confidence,
        RegionEvidence regionEvidence,
        boolean numberValidated) {

    public ExtractedFields {
        Objects.requireNonNull(regionEvidence, "regionEvidence");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
    }

    public boolean hasDocumentNumber() {
        return documentNumber != null;
    }

    public int personalFieldCount() {
        return (int) Stream.of(givenName, familyName, dateOfBirth).filter(Objects::nonNull).count();
    }
}
