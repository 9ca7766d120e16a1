package com.example.reqbot.model;

import java.util.List;

/**
 * Input of one document extraction run.
 *
 * @param documentId          identifier used in labels and logs (usually the file name without extension)
 * @param pages               raw text of each page, in page order
 * @param languageHint        forced ISO 639-1 code, or {@code null} for automatic detection
 * @param keywordProfile      domain keywords merged into the language profile, may be {@code null}
 * @param confidenceThreshold acceptance threshold, or {@code null} for the configured default
 */
public record ExtractionRequest(
        String documentId,
        List<String> pages,
        String languageHint,
        KeywordProfile keywordProfile,
        Double confidenceThreshold
) {
    public ExtractionRequest {
        documentId = documentId == null || documentId.isBlank() ? "document" : documentId.trim();
        pages = pages == null ? List.of() : pages.stream().map(p -> p == null ? "" : p).toList();
        keywordProfile = keywordProfile == null ? KeywordProfile.empty() : keywordProfile;
    }

    public static ExtractionRequest of(String documentId, List<String> pages) {
        return new ExtractionRequest(documentId, pages, null, null, null);
    }
}
