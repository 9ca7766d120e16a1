package com.example.reqbot.nlp;

import java.util.List;

/**
 * One segmented sentence.
 *
 * @param text   sentence text, single-line
 * @param start  start offset in the segmented text (inclusive)
 * @param end    end offset in the segmented text (exclusive)
 * @param tokens lower-cased word tokens, punctuation excluded
 */
public record Sentence(String text, int start, int end, List<String> tokens) {

    public Sentence {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public int wordCount() {
        return tokens.size();
    }
}
