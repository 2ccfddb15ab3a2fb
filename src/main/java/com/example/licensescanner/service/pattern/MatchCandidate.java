package com.example.licensescanner.service.pattern;

import com.example.licensescanner.service.catalog.RegionRule;

/**
 * A document line (or the value following a document-number field code) that satisfied a region's
 * number rule.
 *
 * @param lineIndex index of the source line
 * @param value     matched text, upper-cased
 * @param region    region whose rule matched
 * @param anchor    whether the whole line or a field-code value was matched
 */
public record MatchCandidate(int lineIndex, String value, RegionRule region, Anchor anchor) {

    public enum Anchor {
        FULL_LINE,
        FIELD_VALUE
    }
}
