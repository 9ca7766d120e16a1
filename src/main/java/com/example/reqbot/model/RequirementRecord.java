package com.example.reqbot.model;

import java.util.List;

/**
 * A finalized, scored and classified requirement. Immutable once produced.
 *
 * @param label       {@code <doc>-Req#<page>-<seq>}
 * @param description requirement sentence
 * @param page        1-indexed page number
 * @param keyword     requirement keyword that triggered the match
 * @param language    ISO 639-1 code of the document language
 * @param confidence  heuristic confidence (0.0-1.0)
 * @param priority    priority tier
 * @param category    requirement category
 * @param rawTokens   sentence tokens, used by highlighters to locate the text on the page
 */
public record RequirementRecord(
        String label,
        String description,
        int page,
        String keyword,
        String language,
        double confidence,
        Priority priority,
        Category category,
        List<String> rawTokens
) {
    public RequirementRecord {
        rawTokens = rawTokens == null ? List.of() : List.copyOf(rawTokens);
    }

    /** Note text attached to highlights: {@code label:description}. */
    public String note() {
        return label + ":" + description;
    }
}
