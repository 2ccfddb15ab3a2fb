package com.example.licensescanner.service.fieldcode;

import com.example.licensescanner.service.extraction.RawDocument;
import com.example.licensescanner.service.fieldcode.FieldCodeSet.MarkerMatch;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds values announced by field-code markers. A marker standing alone on its line takes its value
 * from the following line, which is how many OCR engines split label and value when they are
 * printed one above the other. Each field keeps its first occurrence; later duplicates are treated
 * as scan noise. Barcode element ids are only recognised when the document is a barcode dump.
 */
@Component
public class FieldCodeLocator {

    private static final Logger log = LoggerFactory.getLogger(FieldCodeLocator.class);

    public Map<LogicalField, LocatedField> locate(RawDocument document, FieldCodeSet codeSet) {
        Map<LogicalField, LocatedField> located = new EnumMap<>(LogicalField.class);
        List<String> lines = document.lines();
        boolean barcodeDump = FieldCodeSet.isBarcodeDump(lines);
        for (int index = 0; index < lines.size(); index++) {
            Optional<MarkerMatch> match = codeSet.match(lines.get(index), barcodeDump);
            if (match.isEmpty()) {
                continue;
            }
            FieldCode code = match.get().code();
            LocatedField candidate = capture(match.get(), index, lines, codeSet, barcodeDump);
            if (candidate == null) {
                log.debug("Field code {} on line {} carries no value", code.marker(), index);
                continue;
            }
            LocatedField existing = located.putIfAbsent(code.field(), candidate);
            if (existing != null) {
                log.warn("Duplicate {} field code on line {} (first seen on line {}); keeping the first occurrence",
                        code.field(), index, existing.lineIndex());
            }
        }
        return Collections.unmodifiableMap(located);
    }

    private LocatedField capture(MarkerMatch match, int index, List<String> lines, FieldCodeSet codeSet,
                                 boolean barcodeDump) {
        FieldCode code = match.code();
        if (match.hasValue()) {
            return new LocatedField(code.field(), match.value(), index, code.marker(), false);
        }
        int next = index + 1;
        if (next >= lines.size()) {
            return null;
        }
        String nextLine = FieldCodeSet.normalize(lines.get(next));
        if (nextLine.isEmpty() || codeSet.match(nextLine, barcodeDump).isPresent()) {
            return null;
        }
        return new LocatedField(code.field(), nextLine, next, code.marker(), true);
    }
}
