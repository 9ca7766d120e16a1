package com.example.reqbot.model;

/**
 * Outcome of document language detection.
 *
 * @param languageCode  ISO 639-1 code of the language used downstream
 * @param confidence    detection confidence (0.0-1.0)
 * @param lowConfidence true when the code is a fallback rather than a confident detection
 */
public record DetectionResult(
        String languageCode,
        double confidence,
        boolean lowConfidence
) {
    public static DetectionResult forced(String languageCode) {
        return new DetectionResult(languageCode, 1.0, false);
    }
}
