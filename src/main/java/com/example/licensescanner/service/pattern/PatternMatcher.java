package com.example.licensescanner.service.pattern;

import com.example.licensescanner.service.catalog.RegionCatalog;
import com.example.licensescanner.service.catalog.RegionRule;
import com.example.licensescanner.service.extraction.DateOfBirthParser;
import com.example.licensescanner.service.extraction.RawDocument;
import com.example.licensescanner.service.fieldcode.FieldCodeSet;
import com.example.licensescanner.service.fieldcode.FieldCodeSet.MarkerMatch;
import com.example.licensescanner.service.fieldcode.LogicalField;
import com.example.licensescanner.service.pattern.MatchCandidate.Anchor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Applies region number rules to document lines. Only whole candidates are matched: a trimmed line,
 * or the value that follows a document-number field code on that line. Substrings of longer lines
 * are never considered, which keeps digits from addresses and dates from passing as numbers.
 */
@Component
public class PatternMatcher {

    private final RegionCatalog catalog;
    private final FieldCodeSet numberCodes;

    public PatternMatcher(RegionCatalog catalog, FieldCodeSet fieldCodes) {
        this.catalog = catalog;
        this.numberCodes = fieldCodes.only(LogicalField.DOCUMENT_NUMBER);
    }

    /**
     * Validate {@code candidate} against the rule of {@code regionCode}.
     *
     * @throws com.example.licensescanner.service.catalog.UnknownRegionException for an unknown code
     */
    public boolean matches(String regionCode, String candidate) {
        return matches(catalog.lookup(regionCode), candidate);
    }

    public boolean matches(RegionRule region, String candidate) {
        return region.numberRule().matches(normalize(candidate));
    }

    /**
     * Regions whose rule accepts {@code candidate}, in catalog order.
     */
    public List<RegionRule> matchingRegions(String candidate) {
        String normalized = normalize(candidate);
        return catalog.all().stream()
                .filter(region -> region.numberRule().matches(normalized))
                .toList();
    }

    /**
     * First line, in document order, that satisfies the rule of {@code region}.
     */
    public Optional<MatchCandidate> firstMatch(RawDocument document, RegionRule region) {
        for (CandidateLine line : candidateLines(document)) {
            if (region.numberRule().matches(line.value())) {
                return Optional.of(new MatchCandidate(line.index(), line.value(), region, line.anchor()));
            }
        }
        return Optional.empty();
    }

    /**
     * First line, in document order, that satisfies any rule. When several rules accept it the
     * region listed first in the catalog owns the match.
     */
    public Optional<MatchCandidate> firstMatchAnyRegion(RawDocument document) {
        for (CandidateLine line : candidateLines(document)) {
            List<RegionRule> regions = matchingRegions(line.value());
            if (!regions.isEmpty()) {
                return Optional.of(new MatchCandidate(line.index(), line.value(), regions.get(0), line.anchor()));
            }
        }
        return Optional.empty();
    }

    /**
     * Regions whose rule accepts at least one line of the document, in catalog order, each with the
     * first line it accepted.
     */
    public List<MatchCandidate> inferRegions(RawDocument document) {
        List<CandidateLine> lines = candidateLines(document);
        List<MatchCandidate> inferred = new ArrayList<>();
        for (RegionRule region : catalog.all()) {
            lines.stream()
                    .filter(line -> region.numberRule().matches(line.value()))
                    .findFirst()
                    .map(line -> new MatchCandidate(line.index(), line.value(), region, line.anchor()))
                    .ifPresent(inferred::add);
        }
        return inferred;
    }

    private List<CandidateLine> candidateLines(RawDocument document) {
        List<CandidateLine> candidates = new ArrayList<>();
        List<String> lines = document.lines();
        boolean barcodeDump = FieldCodeSet.isBarcodeDump(lines);
        for (int index = 0; index < lines.size(); index++) {
            int position = index;
            String line = lines.get(index);
            Optional<MarkerMatch> marker = numberCodes.match(line, barcodeDump);
            CandidateLine candidate = marker.filter(MarkerMatch::hasValue)
                    .map(match -> new CandidateLine(position, normalize(match.value()), Anchor.FIELD_VALUE))
                    .orElseGet(() -> new CandidateLine(position, normalize(line), Anchor.FULL_LINE));
            if (!candidate.value().isEmpty() && !DateOfBirthParser.isCompactDate(candidate.value())) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    private static String normalize(String candidate) {
        return candidate == null ? "" : candidate.trim().toUpperCase(Locale.ROOT);
    }

    private record CandidateLine(int index, String value, Anchor anchor) {
    }
}
