package com.example.licensescanner.api.dto;

import com.example.licensescanner.service.ScanOutcome;
import com.example.licensescanner.service.extraction.ExtractedFields;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDate;
import java.util.List;

public record LicenseScanResponse(
        @Schema(description = "Licence number, null when none was found")
        String documentNumber,
        @Schema(description = "Two-letter issuing region code, null when unresolved")
        String region,
        @Schema(description = "How the issuing region was determined")
        String regionEvidence,
        @Schema(description = "Whether the number matches the issuing region's number format")
        boolean numberValidated,
        String givenName,
        String familyName,
        @Schema(description = "Date of birth in ISO-8601 format")
        LocalDate dateOfBirth,
        @Schema(description = "Extraction confidence between 0 and 1")
        double confidence,
        @Schema(description = "Number of text lines the extraction saw")
        int lineCount,
        @Schema(description = "Text lines the extraction saw, as recognised by OCR")
        List<String> lines,
        @Schema(description = "Mean OCR line confidence between 0 and 1; absent when no OCR ran")
        Double ocrConfidence) {

    public static LicenseScanResponse from(ScanOutcome outcome) {
        ExtractedFields fields = outcome.fields();
        return new LicenseScanResponse(
                fields.documentNumber(),
                fields.regionCode(),
                fields.regionEvidence().name(),
                fields.numberValidated(),
                fields.givenName(),
                fields.familyName(),
                fields.dateOfBirth(),
                fields.confidence(),
                outcome.lineCount(),
                outcome.lines(),
                outcome.meanOcrConfidence());
    }
}
