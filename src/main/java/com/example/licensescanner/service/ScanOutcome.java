package com.example.licensescanner.service;

import com.example.licensescanner.service.extraction.ExtractedFields;
import java.util.List;

/**
 * Result of one scan: the extracted fields plus the text they were read from.
 *
 * @param fields            extracted fields and their confidence
 * @param lines             text lines the extraction saw, as recognised
 * @param meanOcrConfidence mean per-line recognition confidence, {@code null} when no OCR ran
 */
public record ScanOutcome(ExtractedFields fields, List<String> lines, Double meanOcrConfidence) {

    public ScanOutcome {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public int lineCount() {
        return lines.size();
    }
}
