package com.example.licensescanner.service.ocr;

/**
 * Optical character recognition backend. Implementations turn an encoded image into text lines in
 * reading order.
 */
public interface OcrEngine {

    /**
     * @param image encoded image bytes (PNG, JPEG, BMP or GIF)
     * @return recognised lines, possibly none
     * @throws OcrFailureException when the image cannot be decoded or the engine fails
     */
    OcrText recognize(byte[] image);
}
