package com.example.licensescanner.service.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Declarative shape of a document number: an ordered list of {@link Segment segments}, each with an
 * exact repeat count. A candidate matches when its length equals the total segment length and every
 * character falls into the class of the segment covering its position. There are no wildcards and
 * no optional parts.
 *
 * <p>Rules can be written in a compact notation where {@code L} stands for letters and {@code D} for
 * digits, each followed by a count: {@code L1D7} is one letter followed by seven digits.
 */
public final class NumberRule {

    private final List<Segment> segments;
    private final int length;

    public NumberRule(List<Segment> segments) {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("A number rule needs at least one segment");
        }
        this.segments = List.copyOf(segments);
        this.length = this.segments.stream().mapToInt(Segment::count).sum();
    }

    public static NumberRule of(Segment... segments) {
        return new NumberRule(List.of(segments));
    }

    /**
     * Parse the compact {@code L1D7} notation.
     *
     * @param notation rule text, case-insensitive, surrounding whitespace ignored
     * @return parsed rule
     * @throws IllegalArgumentException when the notation is malformed
     */
    public static NumberRule parse(String notation) {
        if (notation == null || notation.isBlank()) {
            throw new IllegalArgumentException("Number rule notation must not be blank");
        }
        String text = notation.trim().toUpperCase(Locale.ROOT);
        List<Segment> parsed = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            CharClass charClass = CharClass.fromSymbol(text.charAt(index));
            int start = ++index;
            while (index < text.length() && Character.isDigit(text.charAt(index))) {
                index++;
            }
            if (start == index) {
                throw new IllegalArgumentException("Missing count after '" + charClass.symbol() + "' in " + notation);
            }
            parsed.add(new Segment(charClass, Integer.parseInt(text.substring(start, index))));
        }
        return new NumberRule(parsed);
    }

    public boolean matches(String candidate) {
        if (candidate == null || candidate.length() != length) {
            return false;
        }
        int position = 0;
        for (Segment segment : segments) {
            for (int i = 0; i < segment.count(); i++) {
                if (!segment.charClass().accepts(candidate.charAt(position++))) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Build a string that satisfies this rule, cycling through {@code A..Z} and {@code 1..9}.
     */
    public String sample() {
        StringBuilder builder = new StringBuilder(length);
        int position = 0;
        for (Segment segment : segments) {
            for (int i = 0; i < segment.count(); i++, position++) {
                builder.append(segment.charClass() == CharClass.LETTER
                        ? (char) ('A' + position % 26)
                        : (char) ('1' + position % 9));
            }
        }
        return builder.toString();
    }

    public List<Segment> segments() {
        return segments;
    }

    public int length() {
        return length;
    }

    public String notation() {
        return segments.stream().map(Segment::notation).collect(Collectors.joining());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NumberRule rule)) {
            return false;
        }
        return segments.equals(rule.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return notation();
    }
}
