package com.bookforge.ocr.model.json;

/**
 * Raised when an OCR document cannot be read: unreadable source, malformed
 * JSON, or content that does not describe valid lines and regions.
 */
public class OcrInputException extends Exception {

    public OcrInputException(String message) {
        super(message);
    }

    public OcrInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
