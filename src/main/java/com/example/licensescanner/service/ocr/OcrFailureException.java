package com.example.licensescanner.service.ocr;

public class OcrFailureException extends RuntimeException {

    private final Kind kind;

    public OcrFailureException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OcrFailureException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        /** The payload is empty or not an image format the engine can decode. */
        UNREADABLE_IMAGE,
        /** The OCR engine itself failed. */
        ENGINE_ERROR
    }
}
