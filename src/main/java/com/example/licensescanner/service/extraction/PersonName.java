package com.example.licensescanner.service.extraction;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Given and family name split out of a full name printed after a single label. {@code DOE, JOHN}
 * reads family name first; otherwise the first word is the given name and the last word, when there
 * is more than one, the family name.
 */
record PersonName(String givenName, String familyName) {

    private static final Set<String> STOP_WORDS = Set.of(
            "LIC", "LICENSE", "DL", "DOB", "CLASS", "EXPIRES", "EXP", "ISS", "SEX", "STATE");

    static PersonName parse(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return new PersonName(null, null);
        }
        int comma = fullName.indexOf(',');
        if (comma >= 0) {
            List<String> family = words(fullName.substring(0, comma));
            List<String> given = words(fullName.substring(comma + 1));
            return new PersonName(given.isEmpty() ? null : given.get(0),
                    family.isEmpty() ? null : String.join(" ", family));
        }
        List<String> words = words(fullName);
        if (words.isEmpty()) {
            return new PersonName(null, null);
        }
        if (words.size() == 1) {
            return new PersonName(words.get(0), null);
        }
        return new PersonName(words.get(0), words.get(words.size() - 1));
    }

    /**
     * Words up to the first field keyword that OCR ran into the name.
     */
    private static List<String> words(String text) {
        List<String> all = Arrays.stream(text.trim().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .toList();
        int end = 0;
        while (end < all.size() && !STOP_WORDS.contains(all.get(end).toUpperCase(Locale.ROOT))) {
            end++;
        }
        return all.subList(0, end);
    }
}
