package com.example.licensescanner.service.fieldcode;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable collection of {@link FieldCode field codes}. Markers are tried longest first so that
 * {@code DLN} wins over {@code DL} and {@code LIC#} over {@code LIC}.
 */
public final class FieldCodeSet {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s:#.\\-]+");
    private static final Pattern LEADING_COMPLIANCE = Pattern.compile("^@\\s*");

    private static final FieldCodeSet STANDARD = new FieldCodeSet(List.of(
            FieldCode.elementId("DCS", LogicalField.FAMILY_NAME),
            FieldCode.label("LN", LogicalField.FAMILY_NAME),
            FieldCode.label("LAST NAME", LogicalField.FAMILY_NAME),
            FieldCode.label("FAMILY NAME", LogicalField.FAMILY_NAME),
            FieldCode.label("SURNAME", LogicalField.FAMILY_NAME),
            FieldCode.elementId("DAC", LogicalField.GIVEN_NAME),
            FieldCode.elementId("DCT", LogicalField.GIVEN_NAME),
            FieldCode.label("FN", LogicalField.GIVEN_NAME),
            FieldCode.label("FIRST NAME", LogicalField.GIVEN_NAME),
            FieldCode.label("GIVEN NAME", LogicalField.GIVEN_NAME),
            FieldCode.label("GIVEN NAMES", LogicalField.GIVEN_NAME),
            FieldCode.label("NAME", LogicalField.FULL_NAME),
            FieldCode.label("FULL NAME", LogicalField.FULL_NAME),
            FieldCode.label("LICENSEE", LogicalField.FULL_NAME),
            FieldCode.elementId("DBB", LogicalField.DATE_OF_BIRTH),
            FieldCode.label("DOB", LogicalField.DATE_OF_BIRTH),
            FieldCode.glued("D.O.B.", LogicalField.DATE_OF_BIRTH),
            FieldCode.label("DATE OF BIRTH", LogicalField.DATE_OF_BIRTH),
            FieldCode.label("BIRTH DATE", LogicalField.DATE_OF_BIRTH),
            FieldCode.label("BIRTHDATE", LogicalField.DATE_OF_BIRTH),
            FieldCode.label("BIRTH", LogicalField.DATE_OF_BIRTH),
            FieldCode.label("BORN", LogicalField.DATE_OF_BIRTH),
            FieldCode.elementId("DAQ", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("DL", LogicalField.DOCUMENT_NUMBER),
            FieldCode.glued("DL#", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("DL NO", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("DLN", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("4D", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("4D DLN", LogicalField.DOCUMENT_NUMBER),
            FieldCode.glued("ID#", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("LIC", LogicalField.DOCUMENT_NUMBER),
            FieldCode.glued("LIC#", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("LIC NO", LogicalField.DOCUMENT_NUMBER),
            FieldCode.glued("LICENSE#", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("LICENSE NO", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("LICENSE NUMBER", LogicalField.DOCUMENT_NUMBER),
            FieldCode.label("NUMBER", LogicalField.DOCUMENT_NUMBER)
    ));

    /**
     * Element ids that mark a line as part of an AAMVA barcode dump, including elements this service
     * does not extract (expiry, issue date, address, physical description).
     */
    private static final Set<String> BARCODE_ELEMENT_IDS = Set.of(
            "DAQ", "DCS", "DAC", "DAD", "DCT", "DBB", "DBA", "DBD", "DBC", "DAG", "DAI", "DAJ", "DAK",
            "DAU", "DAY", "DCA", "DCB", "DCD", "DCF", "DCG");

    private final List<FieldCode> codes;

    public FieldCodeSet(Collection<FieldCode> codes) {
        this.codes = codes.stream()
                .sorted(Comparator.comparingInt((FieldCode code) -> code.marker().length()).reversed())
                .toList();
    }

    /**
     * AAMVA element ids plus the labels commonly printed on US licences.
     */
    public static FieldCodeSet standard() {
        return STANDARD;
    }

    public FieldCodeSet only(Set<LogicalField> fields) {
        return new FieldCodeSet(codes.stream().filter(code -> fields.contains(code.field())).toList());
    }

    public FieldCodeSet only(LogicalField first, LogicalField... rest) {
        return only(EnumSet.of(first, rest));
    }

    public List<FieldCode> codes() {
        return codes;
    }

    /**
     * Match the start of {@code line} against the markers of this set.
     *
     * @param barcodeDump whether the line belongs to a barcode dump; element ids are only honoured
     *                    there
     * @return the marker found and the remaining value (possibly empty), or empty when the line does
     * not start with a known marker
     */
    public Optional<MarkerMatch> match(String line, boolean barcodeDump) {
        String normalized = normalize(line);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (FieldCode code : codes) {
            if (code.kind() == FieldCode.Kind.ELEMENT_ID && !barcodeDump) {
                continue;
            }
            String marker = code.marker();
            if (!normalized.regionMatches(true, 0, marker, 0, marker.length())) {
                continue;
            }
            String rest = normalized.substring(marker.length());
            if (code.requiresSeparator() && !rest.isEmpty() && !isSeparator(rest.charAt(0))) {
                continue;
            }
            String value = LEADING_SEPARATORS.matcher(rest).replaceFirst("").trim();
            return Optional.of(new MarkerMatch(code, value));
        }
        return Optional.empty();
    }

    /**
     * Whether {@code lines} look like the text of an AAMVA PDF417 barcode: an {@code ANSI} header
     * line, or at least two different element ids at line starts.
     */
    public static boolean isBarcodeDump(List<String> lines) {
        Set<String> seen = new HashSet<>();
        for (String line : lines) {
            String normalized = LEADING_COMPLIANCE.matcher(normalize(line)).replaceFirst("")
                    .toUpperCase(Locale.ROOT);
            if (normalized.startsWith("ANSI ")) {
                return true;
            }
            if (normalized.length() > 3 && BARCODE_ELEMENT_IDS.contains(normalized.substring(0, 3))) {
                seen.add(normalized.substring(0, 3));
                if (seen.size() >= 2) {
                    return true;
                }
            }
        }
        return false;
    }

    static String normalize(String line) {
        if (line == null) {
            return "";
        }
        return WHITESPACE.matcher(line.trim()).replaceAll(" ");
    }

    private static boolean isSeparator(char value) {
        return Character.isWhitespace(value) || value == ':' || value == '#' || value == '.' || value == '-';
    }

    public record MarkerMatch(FieldCode code, String value) {

        public boolean hasValue() {
            return !value.isEmpty();
        }
    }
}
