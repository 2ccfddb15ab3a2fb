package com.example.licensescanner.service.extraction;

import com.example.licensescanner.config.ScannerProperties;
import com.example.licensescanner.service.catalog.RegionCatalog;
import com.example.licensescanner.service.catalog.RegionRule;
import com.example.licensescanner.service.catalog.UnknownRegionException;
import com.example.licensescanner.service.fieldcode.FieldCodeLocator;
import com.example.licensescanner.service.fieldcode.FieldCodeSet;
import com.example.licensescanner.service.fieldcode.LocatedField;
import com.example.licensescanner.service.fieldcode.LogicalField;
import com.example.licensescanner.service.pattern.MatchCandidate;
import com.example.licensescanner.service.pattern.PatternMatcher;
import com.example.licensescanner.service.scoring.ConfidenceScorer;
import com.example.licensescanner.service.scoring.ScoringSignals;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maps the OCR lines of one document to {@link ExtractedFields}. Extraction runs four steps in a
 * fixed order: region resolution, number extraction, personal field extraction and assembly. The
 * extractor holds no per-call state, so one instance serves concurrent requests.
 */
@Service
public class FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PLAUSIBLE_NUMBER = Pattern.compile("(?=.*\\d)[A-Z0-9]{4,20}");

    private final RegionCatalog catalog;
    private final PatternMatcher matcher;
    private final FieldCodeLocator locator;
    private final FieldCodeSet fieldCodes;
    private final ConfidenceScorer scorer;
    private final ScannerProperties.Extraction settings;
    private final Map<RegionRule, Pattern> headerPhrases;
    private final Map<RegionRule, Pattern> mentions;

    public FieldExtractor(RegionCatalog catalog,
                          PatternMatcher matcher,
                          FieldCodeLocator locator,
                          FieldCodeSet fieldCodes,
                          ConfidenceScorer scorer,
                          ScannerProperties properties) {
        this.catalog = catalog;
        this.matcher = matcher;
        this.locator = locator;
        this.fieldCodes = fieldCodes;
        this.scorer = scorer;
        this.settings = properties.extraction();
        this.headerPhrases = new LinkedHashMap<>();
        this.mentions = new LinkedHashMap<>();
        for (RegionRule region : catalog.all()) {
            String name = Pattern.quote(region.name());
            headerPhrases.put(region, Pattern.compile(
                    "\\b(?:(?i:STATE\\s+OF)\\s+(?:" + region.code() + "|(?i:" + name + "))\\b"
                            + "|(?:" + region.code() + "|(?i:" + name + "))\\s+(?i:DRIVER|LICENSE))"));
            mentions.put(region, Pattern.compile("\\b" + name + "\\b", Pattern.CASE_INSENSITIVE));
        }
    }

    /**
     * Extract the structured fields of {@code document}.
     *
     * @param document   OCR lines in top-to-bottom order
     * @param regionHint optional region code supplied by the caller; unknown codes are ignored
     * @return extraction result; missing fields are {@code null}
     * @throws MalformedInputException when the document has no lines or too many lines
     */
    public ExtractedFields extract(RawDocument document, String regionHint) {
        validate(document);
        Map<LogicalField, LocatedField> located = locator.locate(document, fieldCodes);
        Resolution region = resolveRegion(document, regionHint);
        NumberExtraction number = extractNumber(document, region, located);
        region = number.region();

        String familyName = valueOf(located, LogicalField.FAMILY_NAME);
        String givenName = valueOf(located, LogicalField.GIVEN_NAME);
        LocatedField fullName = located.get(LogicalField.FULL_NAME);
        if (fullName != null && (familyName == null || givenName == null)) {
            PersonName split = PersonName.parse(fullName.value());
            familyName = familyName != null ? familyName : split.familyName();
            givenName = givenName != null ? givenName : split.givenName();
        }
        LocalDate dateOfBirth = dateOfBirth(located);

        ScoringSignals signals = new ScoringSignals(
                number.validated(),
                region.evidence().confirmed(),
                region.evidence() == RegionEvidence.AMBIGUOUS,
                countPresent(familyName, givenName, dateOfBirth));
        double confidence = scorer.score(signals);

        ExtractedFields fields = new ExtractedFields(
                number.value(),
                region.rule() != null ? region.rule().code() : null,
                givenName,
                familyName,
                dateOfBirth,
                confidence,
                region.evidence(),
                number.validated());
        log.debug("Extracted region {} ({}), number present: {}, validated: {}, personal fields: {}, confidence: {}",
                fields.regionCode(), fields.regionEvidence(), fields.hasDocumentNumber(), fields.numberValidated(),
                signals.personalFieldCount(), confidence);
        return fields;
    }

    public ExtractedFields extract(RawDocument document) {
        return extract(document, null);
    }

    private void validate(RawDocument document) {
        if (document == null || document.isEmpty()) {
            throw new MalformedInputException("Document contains no text lines");
        }
        if (document.size() > settings.maxLines()) {
            throw new MalformedInputException(String.format(Locale.ROOT,
                    "Document has %d lines, more than the allowed %d", document.size(), settings.maxLines()));
        }
    }

    private Resolution resolveRegion(RawDocument document, String regionHint) {
        if (regionHint != null && !regionHint.isBlank()) {
            try {
                return new Resolution(catalog.lookup(regionHint), RegionEvidence.HINT);
            } catch (UnknownRegionException ex) {
                log.warn("{}; resolving the region from the document instead", ex.getMessage());
            }
        }

        Optional<RegionRule> header = headerRegion(document);
        if (header.isPresent()) {
            return new Resolution(header.get(), RegionEvidence.HEADER);
        }

        List<RegionRule> mentioned = mentionedRegions(document);
        Optional<RegionRule> mentionedWithNumber = mentioned.stream()
                .filter(region -> matcher.firstMatch(document, region).isPresent())
                .findFirst();
        if (mentionedWithNumber.isPresent()) {
            return new Resolution(mentionedWithNumber.get(), RegionEvidence.MENTIONED);
        }

        if (settings.regionInferenceEnabled()) {
            List<MatchCandidate> inferred = matcher.inferRegions(document);
            if (!inferred.isEmpty()) {
                MatchCandidate first = inferred.get(0);
                if (matcher.matchingRegions(first.value()).size() > 1) {
                    log.debug("Number rules of several regions accept line {}; choosing {}", first.lineIndex(),
                            first.region().code());
                    return new Resolution(first.region(), RegionEvidence.AMBIGUOUS);
                }
                return new Resolution(first.region(), RegionEvidence.INFERRED);
            }
        }
        if (!mentioned.isEmpty()) {
            return new Resolution(mentioned.get(0), RegionEvidence.MENTIONED);
        }
        return Resolution.unresolved();
    }

    /**
     * Region named by a header. Lines consisting of the name alone come first, then header phrases.
     * Among several named regions the first one whose number rule accepts a line wins, then document
     * order decides.
     */
    private Optional<RegionRule> headerRegion(RawDocument document) {
        List<RegionRule> named = new ArrayList<>();
        for (String line : document.lines()) {
            String normalized = normalize(line);
            for (RegionRule region : catalog.all()) {
                if (normalized.equalsIgnoreCase(region.name()) && !named.contains(region)) {
                    named.add(region);
                }
            }
        }
        for (String line : document.lines()) {
            String normalized = normalize(line);
            headerPhrases.forEach((region, pattern) -> {
                if (!named.contains(region) && pattern.matcher(normalized).find()) {
                    named.add(region);
                }
            });
        }
        if (named.size() <= 1) {
            return named.stream().findFirst();
        }
        return named.stream()
                .filter(region -> matcher.firstMatch(document, region).isPresent())
                .findFirst()
                .or(() -> Optional.of(named.get(0)));
    }

    /**
     * Regions whose name appears as a whole word inside some line, in document order.
     */
    private List<RegionRule> mentionedRegions(RawDocument document) {
        List<RegionRule> mentioned = new ArrayList<>();
        for (String line : document.lines()) {
            String normalized = normalize(line);
            mentions.forEach((region, pattern) -> {
                if (!mentioned.contains(region) && pattern.matcher(normalized).find()) {
                    mentioned.add(region);
                }
            });
        }
        return mentioned;
    }

    private NumberExtraction extractNumber(RawDocument document, Resolution region,
                                           Map<LogicalField, LocatedField> located) {
        if (region.rule() != null) {
            Optional<MatchCandidate> match = matcher.firstMatch(document, region.rule());
            if (match.isPresent()) {
                return new NumberExtraction(match.get().value(), true, region);
            }
        } else {
            Optional<MatchCandidate> match = matcher.firstMatchAnyRegion(document);
            if (match.isPresent()) {
                return new NumberExtraction(match.get().value(), true, ownerOf(match.get().value()));
            }
        }
        return labeledNumber(located.get(LogicalField.DOCUMENT_NUMBER), region);
    }

    /**
     * Value printed after a document-number field code that no line-level rule accepted. Internal
     * whitespace is removed before the value is checked against the rules once more; a value that
     * still fails is returned unvalidated.
     */
    private NumberExtraction labeledNumber(LocatedField labeled, Resolution region) {
        if (labeled == null) {
            return new NumberExtraction(null, false, region);
        }
        String compact = WHITESPACE.matcher(labeled.value()).replaceAll("").toUpperCase(Locale.ROOT);
        if (!PLAUSIBLE_NUMBER.matcher(compact).matches() || DateOfBirthParser.isCompactDate(compact)) {
            log.debug("Ignoring implausible document number after field code {}", labeled.marker());
            return new NumberExtraction(null, false, region);
        }
        if (region.rule() != null) {
            return new NumberExtraction(compact, matcher.matches(region.rule(), compact), region);
        }
        if (!matcher.matchingRegions(compact).isEmpty()) {
            return new NumberExtraction(compact, true, ownerOf(compact));
        }
        return new NumberExtraction(compact, false, region);
    }

    private Resolution ownerOf(String number) {
        List<RegionRule> owners = matcher.matchingRegions(number);
        RegionEvidence evidence = owners.size() > 1 ? RegionEvidence.AMBIGUOUS : RegionEvidence.INFERRED;
        return new Resolution(owners.get(0), evidence);
    }

    private LocalDate dateOfBirth(Map<LogicalField, LocatedField> fields) {
        LocatedField located = fields.get(LogicalField.DATE_OF_BIRTH);
        if (located == null) {
            return null;
        }
        Optional<LocalDate> parsed = DateOfBirthParser.parse(located.value());
        if (parsed.isEmpty()) {
            log.debug("Date of birth after field code {} on line {} is not a valid date", located.marker(),
                    located.lineIndex());
        }
        return parsed.orElse(null);
    }

    private static String normalize(String line) {
        return WHITESPACE.matcher(line.trim()).replaceAll(" ");
    }

    private static String valueOf(Map<LogicalField, LocatedField> located, LogicalField field) {
        LocatedField value = located.get(field);
        return value != null ? value.value() : null;
    }

    private static int countPresent(Object... values) {
        int count = 0;
        for (Object value : values) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }

    private record Resolution(RegionRule rule, RegionEvidence evidence) {

        static Resolution unresolved() {
            return new Resolution(null, RegionEvidence.NONE);
        }
    }

    private record NumberExtraction(String value, boolean validated, Resolution region) {
    }
}
