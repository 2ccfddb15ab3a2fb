package com.example.licensescanner.service.fieldcode;

/**
 * Value captured for a logical field.
 *
 * @param field     field the value belongs to
 * @param value     captured text with the marker removed and whitespace collapsed; original case
 * @param lineIndex index of the line the value was read from
 * @param marker    marker that announced the value
 * @param adjacent  {@code true} when the marker stood alone and the value came from the next line
 */
public record LocatedField(LogicalField field, String value, int lineIndex, String marker, boolean adjacent) {
}
