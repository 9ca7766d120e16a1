package com.example.reqbot.controller;

import com.example.reqbot.model.ExtractionRequest;
import com.example.reqbot.model.KeywordProfile;

import java.util.List;
import java.util.Set;

/**
 * JSON body of {@code POST /api/requirements}.
 */
public record ExtractionApiRequest(
        String documentId,
        List<String> pages,
        String languageHint,
        String profileName,
        List<String> keywords,
        List<String> priorityHigh,
        List<String> priorityMedium,
        List<String> priorityLow,
        Double confidenceThreshold
) {

    /**
     * @throws IllegalArgumentException if there are no pages or the threshold is outside [0, 1]
     */
    ExtractionRequest toExtractionRequest() {
        if (pages == null || pages.isEmpty()) {
            throw new IllegalArgumentException("No pages provided. Send at least one page of text.");
        }
        if (confidenceThreshold != null && (confidenceThreshold < 0.0 || confidenceThreshold > 1.0)) {
            throw new IllegalArgumentException("confidenceThreshold must be between 0.0 and 1.0");
        }
        KeywordProfile profile = new KeywordProfile(profileName,
                toSet(keywords), toSet(priorityHigh), toSet(priorityMedium), toSet(priorityLow));
        return new ExtractionRequest(documentId, pages, languageHint, profile, confidenceThreshold);
    }

    private static Set<String> toSet(List<String> values) {
        return values == null ? Set.of() : Set.copyOf(values.stream().filter(v -> v != null).toList());
    }
}
