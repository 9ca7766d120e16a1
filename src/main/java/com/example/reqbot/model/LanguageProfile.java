package com.example.reqbot.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-language bundle of requirement keywords, priority tiers, security override keywords,
 * structural patterns, category indicators and the sentence segmentation model id.
 * <p>
 * All keyword sets are lower-cased and keep their configured order.
 */
public record LanguageProfile(
        String code,
        String name,
        String modelId,
        Set<String> keywords,
        Set<String> priorityHigh,
        Set<String> priorityMedium,
        Set<String> priorityLow,
        Set<String> securityKeywords,
        Map<PatternGroup, List<String>> patterns,
        Map<Category, CategoryIndicators> categories
) {
    public LanguageProfile {
        keywords = lowerCased(keywords);
        priorityHigh = lowerCased(priorityHigh);
        priorityMedium = lowerCased(priorityMedium);
        priorityLow = lowerCased(priorityLow);
        securityKeywords = lowerCased(securityKeywords);
        patterns = patterns == null || patterns.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(patterns));
        categories = categories == null || categories.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(categories));
    }

    /**
     * Keywords and regular expressions that vote for one category.
     */
    public record CategoryIndicators(Set<String> keywords, List<String> patterns) {
        public CategoryIndicators {
            keywords = lowerCased(keywords);
            patterns = patterns == null ? List.of() : List.copyOf(patterns);
        }
    }

    /** Holds the invariant every supported language must satisfy. */
    public boolean isValid() {
        return code != null && !code.isBlank()
                && modelId != null && !modelId.isBlank()
                && !keywords.isEmpty();
    }

    /**
     * Keywords of one priority tier. {@link Priority#SECURITY} returns the security override keywords.
     */
    public Set<String> priorityKeywords(Priority tier) {
        return switch (tier) {
            case HIGH -> priorityHigh;
            case MEDIUM -> priorityMedium;
            case LOW -> priorityLow;
            case SECURITY -> securityKeywords;
        };
    }

    public List<String> patterns(PatternGroup group) {
        return patterns.getOrDefault(group, List.of());
    }

    /**
     * Returns a copy whose keywords and priority tiers also contain those of the given domain profile.
     */
    public LanguageProfile mergedWith(KeywordProfile domain) {
        if (domain == null || domain.isEmpty()) return this;
        return new LanguageProfile(code, name, modelId,
                union(keywords, domain.keywords()),
                union(priorityHigh, domain.priorityHigh()),
                union(priorityMedium, domain.priorityMedium()),
                union(priorityLow, domain.priorityLow()),
                securityKeywords, patterns, categories);
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> merged = new LinkedHashSet<>(a);
        merged.addAll(b);
        return merged;
    }

    static Set<String> lowerCased(Collection<String> values) {
        if (values == null || values.isEmpty()) return Set.of();
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(result);
    }
}
