package com.example.licensescanner.service.extraction;

/**
 * The OCR input cannot be processed: it has no lines, or more lines than the configured maximum.
 */
public class MalformedInputException extends RuntimeException {

    public MalformedInputException(String message) {
        super(message);
    }
}
