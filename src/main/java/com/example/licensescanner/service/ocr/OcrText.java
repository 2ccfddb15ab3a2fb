package com.example.licensescanner.service.ocr;

import com.example.licensescanner.service.extraction.RawDocument;
import java.util.List;

public record OcrText(List<OcrLine> lines) {

    public OcrText {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public RawDocument toDocument() {
        return new RawDocument(lines.stream().map(OcrLine::text).toList());
    }

    public double meanConfidence() {
        return lines.stream().mapToDouble(OcrLine::confidence).average().orElse(0.0);
    }

    /**
     * @param text       recognised text of the line, trimmed
     * @param confidence recognition confidence in {@code [0, 1]}
     */
    public record OcrLine(String text, double confidence) {
    }
}
