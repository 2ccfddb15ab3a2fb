package com.example.licensescanner.service.fieldcode;

import java.util.Locale;
import java.util.Objects;

/**
 * A marker printed in front of a field value.
 *
 * @param marker marker text; matched case-insensitively at the start of a line
 * @param field  field the marker announces
 * @param kind   how the marker is separated from its value
 */
public record FieldCode(String marker, LogicalField field, Kind kind) {

    public FieldCode {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
        marker = marker.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (marker.isEmpty()) {
            throw new IllegalArgumentException("Field code marker must not be blank");
        }
    }

    public static FieldCode elementId(String marker, LogicalField field) {
        return new FieldCode(marker, field, Kind.ELEMENT_ID);
    }

    public static FieldCode glued(String marker, LogicalField field) {
        return new FieldCode(marker, field, Kind.GLUED);
    }

    public static FieldCode label(String marker, LogicalField field) {
        return new FieldCode(marker, field, Kind.LABEL);
    }

    public boolean requiresSeparator() {
        return kind == Kind.LABEL;
    }

    public enum Kind {
        /**
         * AAMVA element id such as {@code DCS}, glued to its value. Only recognised inside barcode
         * dumps, where ordinary words starting with the same letters do not occur.
         */
        ELEMENT_ID,
        /** Printed marker ending in punctuation, such as {@code DL#}; the value may follow directly. */
        GLUED,
        /** Printed word label such as {@code LN}; whitespace or punctuation must follow it. */
        LABEL
    }
}
