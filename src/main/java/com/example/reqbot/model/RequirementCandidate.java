package com.example.reqbot.model;

import java.util.List;
import java.util.Set;

/**
 * A sentence that passed length validation and keyword matching, pending scoring.
 *
 * @param text            sentence text
 * @param page            1-indexed page number
 * @param tokens          lower-cased word tokens in sentence order
 * @param matchedKeyword  first requirement keyword found in the sentence
 * @param matchedKeywords all distinct requirement keywords found
 * @param languageCode    language of the profile used for matching
 */
public record RequirementCandidate(
        String text,
        int page,
        List<String> tokens,
        String matchedKeyword,
        Set<String> matchedKeywords,
        String languageCode
) {
    public RequirementCandidate {
        tokens = List.copyOf(tokens);
        matchedKeywords = Set.copyOf(matchedKeywords);
    }

    public int wordCount() {
        return tokens.size();
    }
}
