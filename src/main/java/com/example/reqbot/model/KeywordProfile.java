package com.example.reqbot.model;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Domain keyword profile supplied by the caller (e.g. "Aerospace", "Medical").
 * Its keywords and priority tiers are added to those of the document language.
 *
 * @param name           profile name, for logging
 * @param keywords       additional requirement keywords
 * @param priorityHigh   additional high-priority keywords
 * @param priorityMedium additional medium-priority keywords
 * @param priorityLow    additional low-priority keywords
 */
public record KeywordProfile(
        String name,
        Set<String> keywords,
        Set<String> priorityHigh,
        Set<String> priorityMedium,
        Set<String> priorityLow
) {
    public KeywordProfile {
        name = name == null || name.isBlank() ? "custom" : name;
        keywords = normalize(keywords);
        priorityHigh = normalize(priorityHigh);
        priorityMedium = normalize(priorityMedium);
        priorityLow = normalize(priorityLow);
    }

    /** Profile contributing keywords only. */
    public static KeywordProfile ofKeywords(String name, Collection<String> keywords) {
        return new KeywordProfile(name, keywords == null ? Set.of() : Set.copyOf(keywords), Set.of(), Set.of(), Set.of());
    }

    public static KeywordProfile empty() {
        return new KeywordProfile("none", Set.of(), Set.of(), Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return keywords.isEmpty() && priorityHigh.isEmpty() && priorityMedium.isEmpty() && priorityLow.isEmpty();
    }

    static Set<String> normalize(Collection<String> values) {
        if (values == null) return Set.of();
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
