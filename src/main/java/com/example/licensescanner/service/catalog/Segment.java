package com.example.licensescanner.service.catalog;

import java.util.Objects;

/**
 * A run of {@code count} characters of the same {@link CharClass}.
 */
public record Segment(CharClass charClass, int count) {

    public Segment {
        Objects.requireNonNull(charClass, "charClass");
        if (count <= 0) {
            throw new IllegalArgumentException("Segment count must be positive");
        }
    }

    public static Segment letters(int count) {
        return new Segment(CharClass.LETTER, count);
    }

    public static Segment digits(int count) {
        return new Segment(CharClass.DIGIT, count);
    }

    String notation() {
        return String.valueOf(charClass.symbol()) + count;
    }
}
