package com.example.reqbot.service;

import com.example.reqbot.model.Category;
import com.example.reqbot.model.LanguageProfile;
import com.example.reqbot.model.Priority;
import com.example.reqbot.model.RequirementCandidate;
import com.example.reqbot.nlp.Tokenizer;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns priority and category to a requirement candidate.
 * <p>
 * Priority: any security keyword forces {@link Priority#SECURITY}; otherwise the highest matching tier
 * wins (high, then medium), defaulting to low. Category: each category scores +1 per indicator keyword
 * and +3 per indicator pattern, and Security gets +10 when the priority is {@code SECURITY}. A unique
 * highest score wins; a tie at the top or no score at all yields {@link Category#FUNCTIONAL}.
 */
@Service
public class RequirementClassifier {

    static final int KEYWORD_POINTS = 1;
    static final int PATTERN_POINTS = 3;
    static final int SECURITY_PRIORITY_POINTS = 10;

    private final RequirementPatternMatcher patternMatcher;

    public RequirementClassifier(RequirementPatternMatcher patternMatcher) {
        this.patternMatcher = patternMatcher;
    }

    public record Classification(Priority priority, Category category) {}

    public Classification classify(RequirementCandidate candidate, LanguageProfile profile) {
        Priority priority = determinePriority(candidate.tokens(), profile);
        Category category = determineCategory(candidate, profile, priority);
        return new Classification(priority, category);
    }

    public Priority determinePriority(List<String> tokens, LanguageProfile profile) {
        for (Priority tier : List.of(Priority.SECURITY, Priority.HIGH, Priority.MEDIUM)) {
            if (Tokenizer.containsAny(tokens, profile.priorityKeywords(tier))) {
                return tier;
            }
        }
        return Priority.LOW;
    }

    public Category determineCategory(RequirementCandidate candidate, LanguageProfile profile, Priority priority) {
        Map<Category, Integer> scores = tally(candidate, profile, priority);

        Category best = Category.FUNCTIONAL;
        int bestScore = 0;
        boolean tied = false;
        for (Map.Entry<Category, Integer> entry : scores.entrySet()) {
            int score = entry.getValue();
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
                tied = false;
            } else if (score == bestScore && score > 0) {
                tied = true;
            }
        }
        return bestScore == 0 || tied ? Category.FUNCTIONAL : best;
    }

    /** Category scores, for diagnostics. */
    public Map<Category, Integer> tally(RequirementCandidate candidate, LanguageProfile profile, Priority priority) {
        Map<Category, Integer> scores = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            int score = 0;
            LanguageProfile.CategoryIndicators indicators = profile.categories().get(category);
            if (indicators != null) {
                for (String keyword : indicators.keywords()) {
                    if (Tokenizer.containsPhrase(candidate.tokens(), keyword)) {
                        score += KEYWORD_POINTS;
                    }
                }
            }
            score += PATTERN_POINTS * patternMatcher.countCategoryMatches(candidate.text(), profile.code(), category);
            if (category == Category.SECURITY && priority == Priority.SECURITY) {
                score += SECURITY_PRIORITY_POINTS;
            }
            scores.put(category, score);
        }
        return scores;
    }
}
