package com.example.reqbot.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Groups of structural requirement patterns, in evaluation order.
 */
public enum PatternGroup {
    /** "shall provide", "must ensure" */
    MODAL,
    /** "the system shall" */
    SUBJECT_VERB,
    /** "capable of", "ability to" */
    CAPABILITY,
    /** "comply with", "in accordance with" */
    COMPLIANCE,
    /** "it is required that" */
    NECESSITY,
    /** "at least N", "between N and M" */
    QUANTIFIED;

    public static Optional<PatternGroup> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(g -> g.name().equals(normalized))
                .findFirst();
    }
}
