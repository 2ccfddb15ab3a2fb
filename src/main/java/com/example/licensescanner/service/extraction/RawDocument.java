package com.example.licensescanner.service.extraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * OCR output for one document: text lines in the top-to-bottom order reported by the OCR engine.
 * Null lines are kept as empty strings so that line indexes stay aligned with the source.
 */
public record RawDocument(List<String> lines) {

    public RawDocument {
        List<String> copy = new ArrayList<>(lines == null ? List.of() : lines);
        copy.replaceAll(line -> line == null ? "" : line);
        lines = List.copyOf(copy);
    }

    public static RawDocument of(String... lines) {
        return new RawDocument(Arrays.asList(lines));
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
