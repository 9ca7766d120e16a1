package com.example.reqbot.language;

import com.example.reqbot.model.Category;
import com.example.reqbot.model.LanguageProfile;
import com.example.reqbot.model.PatternGroup;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * JSON shape of the language profile configuration file.
 *
 * <pre>
 * { "version": 1, "default_language": "en",
 *   "languages": { "en": { "model_id": "en-sent", "keywords": [...], ... } } }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ProfileConfigDocument(
        @JsonProperty("version") int version,
        @JsonProperty("default_language") String defaultLanguage,
        @JsonProperty("languages") Map<String, LanguageEntry> languages
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LanguageEntry(
            @JsonProperty("name") String name,
            @JsonProperty("model_id") String modelId,
            @JsonProperty("keywords") List<String> keywords,
            @JsonProperty("priority_high") List<String> priorityHigh,
            @JsonProperty("priority_medium") List<String> priorityMedium,
            @JsonProperty("priority_low") List<String> priorityLow,
            @JsonProperty("security_keywords") List<String> securityKeywords,
            @JsonProperty("patterns") Map<String, List<String>> patterns,
            @JsonProperty("categories") Map<String, CategoryEntry> categories
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CategoryEntry(
            @JsonProperty("keywords") List<String> keywords,
            @JsonProperty("patterns") List<String> patterns
    ) {}

    /**
     * Converts and validates the document.
     *
     * @throws ConfigLoadException if a language violates the profile invariant or a pattern does not compile
     */
    Map<String, LanguageProfile> toProfiles() {
        if (languages == null || languages.isEmpty()) {
            throw new ConfigLoadException("No languages defined");
        }
        Map<String, LanguageProfile> profiles = new LinkedHashMap<>();
        languages.forEach((rawCode, entry) -> {
            if (entry == null) {
                throw new ConfigLoadException("Empty entry for language '" + rawCode + "'");
            }
            String code = rawCode.trim().toLowerCase(Locale.ROOT);
            LanguageProfile profile = new LanguageProfile(
                    code,
                    entry.name() != null ? entry.name() : code,
                    entry.modelId(),
                    orderedSet(entry.keywords()),
                    orderedSet(entry.priorityHigh()),
                    orderedSet(entry.priorityMedium()),
                    orderedSet(entry.priorityLow()),
                    orderedSet(entry.securityKeywords()),
                    toPatterns(code, entry.patterns()),
                    toCategories(code, entry.categories()));
            if (!profile.isValid()) {
                throw new ConfigLoadException("Language '" + code + "' needs a model_id and at least one keyword");
            }
            profiles.put(code, profile);
        });
        return profiles;
    }

    static ProfileConfigDocument from(int version, String defaultLanguage, Map<String, LanguageProfile> profiles) {
        Map<String, LanguageEntry> entries = new LinkedHashMap<>();
        profiles.forEach((code, p) -> {
            Map<String, List<String>> patterns = new LinkedHashMap<>();
            p.patterns().forEach((group, list) -> patterns.put(group.name().toLowerCase(Locale.ROOT), list));
            Map<String, CategoryEntry> categories = new LinkedHashMap<>();
            p.categories().forEach((category, ind) -> categories.put(
                    category.name().toLowerCase(Locale.ROOT),
                    new CategoryEntry(new ArrayList<>(ind.keywords()), ind.patterns())));
            entries.put(code, new LanguageEntry(p.name(), p.modelId(),
                    new ArrayList<>(p.keywords()),
                    new ArrayList<>(p.priorityHigh()),
                    new ArrayList<>(p.priorityMedium()),
                    new ArrayList<>(p.priorityLow()),
                    new ArrayList<>(p.securityKeywords()),
                    patterns, categories));
        });
        return new ProfileConfigDocument(version, defaultLanguage, entries);
    }

    private static Map<PatternGroup, List<String>> toPatterns(String code, Map<String, List<String>> raw) {
        Map<PatternGroup, List<String>> result = new EnumMap<>(PatternGroup.class);
        if (raw == null) return result;
        raw.forEach((key, expressions) -> {
            PatternGroup group = PatternGroup.fromKey(key)
                    .orElseThrow(() -> new ConfigLoadException(
                            "Unknown pattern group '" + key + "' for language '" + code + "'"));
            List<String> checked = listOrEmpty(expressions);
            checked.forEach(expression -> checkRegex(code, expression));
            result.put(group, checked);
        });
        return result;
    }

    private static Map<Category, LanguageProfile.CategoryIndicators> toCategories(String code,
                                                                                   Map<String, CategoryEntry> raw) {
        Map<Category, LanguageProfile.CategoryIndicators> result = new EnumMap<>(Category.class);
        if (raw == null) return result;
        raw.forEach((key, entry) -> {
            Category category = Category.fromKey(key)
                    .orElseThrow(() -> new ConfigLoadException(
                            "Unknown category '" + key + "' for language '" + code + "'"));
            if (entry == null) return;
            List<String> patterns = listOrEmpty(entry.patterns());
            patterns.forEach(expression -> checkRegex(code, expression));
            result.put(category, new LanguageProfile.CategoryIndicators(
                    orderedSet(entry.keywords()), patterns));
        });
        return result;
    }

    private static void checkRegex(String code, String expression) {
        try {
            Pattern.compile(expression);
        } catch (PatternSyntaxException e) {
            throw new ConfigLoadException("Invalid pattern for language '" + code + "': " + expression, e);
        }
    }

    private static Set<String> orderedSet(List<String> values) {
        return new LinkedHashSet<>(listOrEmpty(values));
    }

    private static List<String> listOrEmpty(List<String> values) {
        if (values == null) return List.of();
        return values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }
}
