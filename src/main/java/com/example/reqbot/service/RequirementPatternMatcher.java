package com.example.reqbot.service;

import com.example.reqbot.language.LanguageProfileStore;
import com.example.reqbot.model.Category;
import com.example.reqbot.model.LanguageProfile;
import com.example.reqbot.model.PatternGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Structural requirement phrasing detector ("shall provide", "in accordance with", "at least 5").
 * <p>
 * Expressions come from the language profiles and are compiled once per language, case-insensitive with
 * Unicode character classes. Languages without a profile use the default language's expressions.
 */
@Service
public class RequirementPatternMatcher {

    private static final Logger log = LoggerFactory.getLogger(RequirementPatternMatcher.class);

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final LanguageProfileStore profileStore;
    private final Map<String, CompiledPatterns> cache = new ConcurrentHashMap<>();

    /** Compiled expressions of one language. */
    record CompiledPatterns(Map<PatternGroup, List<Pattern>> groups, Map<Category, List<Pattern>> categories) {

        static final CompiledPatterns NONE = new CompiledPatterns(Map.of(), Map.of());

        static CompiledPatterns of(LanguageProfile profile) {
            Map<PatternGroup, List<Pattern>> groups = new EnumMap<>(PatternGroup.class);
            profile.patterns().forEach((group, expressions) -> groups.put(group, compile(expressions)));
            Map<Category, List<Pattern>> categories = new EnumMap<>(Category.class);
            profile.categories().forEach((category, indicators) ->
                    categories.put(category, compile(indicators.patterns())));
            return new CompiledPatterns(Collections.unmodifiableMap(groups), Collections.unmodifiableMap(categories));
        }

        private static List<Pattern> compile(List<String> expressions) {
            return expressions.stream().map(e -> Pattern.compile(e, FLAGS)).toList();
        }
    }

    public RequirementPatternMatcher(LanguageProfileStore profileStore) {
        this.profileStore = profileStore;
    }

    /** True when any structural pattern of {@code languageCode} occurs in {@code sentence}. */
    public boolean matchesAny(String sentence, String languageCode) {
        if (sentence == null || sentence.isBlank()) return false;
        for (List<Pattern> patterns : patternsFor(languageCode).groups().values()) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(sentence).find()) return true;
            }
        }
        return false;
    }

    /** Pattern groups with at least one match, in group order. */
    public Set<PatternGroup> matchingGroups(String sentence, String languageCode) {
        Set<PatternGroup> matched = EnumSet.noneOf(PatternGroup.class);
        if (sentence == null || sentence.isBlank()) return matched;
        patternsFor(languageCode).groups().forEach((group, patterns) -> {
            if (patterns.stream().anyMatch(p -> p.matcher(sentence).find())) {
                matched.add(group);
            }
        });
        return matched;
    }

    /** Number of {@code category} indicator patterns that occur in {@code sentence}. */
    public int countCategoryMatches(String sentence, String languageCode, Category category) {
        if (sentence == null || sentence.isBlank()) return 0;
        List<Pattern> patterns = patternsFor(languageCode).categories().getOrDefault(category, List.of());
        int count = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(sentence).find()) count++;
        }
        return count;
    }

    /** Drops compiled expressions, e.g. after the profiles were reloaded. */
    public void clearCache() {
        cache.clear();
    }

    CompiledPatterns patternsFor(String languageCode) {
        String code = languageCode == null ? "" : languageCode.trim().toLowerCase(Locale.ROOT);
        return cache.computeIfAbsent(code, this::compileFor);
    }

    private CompiledPatterns compileFor(String code) {
        // Explicit fallback chain: requested language, then default language.
        for (String candidate : List.of(code, profileStore.defaultLanguage())) {
            var profile = profileStore.getProfile(candidate);
            if (profile.isPresent()) {
                if (!candidate.equals(code)) {
                    log.warn("No patterns for '{}', using '{}' patterns", code, candidate);
                }
                CompiledPatterns compiled = CompiledPatterns.of(profile.get());
                log.debug("Compiled {} pattern groups for '{}'", compiled.groups().size(), code);
                return compiled;
            }
        }
        return CompiledPatterns.NONE;
    }
}
