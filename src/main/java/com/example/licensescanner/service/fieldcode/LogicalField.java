package com.example.licensescanner.service.fieldcode;

/**
 * Document fields that can be announced by a field-code marker.
 */
public enum LogicalField {
    FAMILY_NAME,
    GIVEN_NAME,
    /** Given and family name printed together after one label. */
    FULL_NAME,
    DATE_OF_BIRTH,
    DOCUMENT_NUMBER
}
