package com.example.reqbot.service;

import com.example.reqbot.model.RequirementCandidate;
import com.example.reqbot.nlp.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.example.reqbot.service.ScoringWeights.*;

/**
 * Multiplicative confidence heuristic for requirement candidates. See {@link ScoringWeights} for the factors.
 */
@Service
public class ConfidenceScorer {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    private final RequirementPatternMatcher patternMatcher;

    public ConfidenceScorer(RequirementPatternMatcher patternMatcher) {
        this.patternMatcher = patternMatcher;
    }

    /**
     * One applied factor.
     *
     * @param name       factor name ({@code length}, {@code keywords}, {@code pattern}, {@code heading}, {@code numeric})
     * @param multiplier value the score was multiplied by
     */
    public record Factor(String name, double multiplier) {}

    /**
     * Factors applied to a candidate and the resulting score.
     */
    public record ScoreBreakdown(List<Factor> factors, double score) {
        public ScoreBreakdown {
            factors = List.copyOf(factors);
        }
    }

    public double score(RequirementCandidate candidate) {
        return breakdown(candidate).score();
    }

    public ScoreBreakdown breakdown(RequirementCandidate candidate) {
        List<Factor> factors = new ArrayList<>();
        int words = candidate.wordCount();

        factors.add(new Factor("length", lengthFactor(words)));

        if (candidate.matchedKeywords().size() >= DENSE_KEYWORD_COUNT) {
            factors.add(new Factor("keywords", KEYWORD_DENSITY_BOOST));
        }
        if (patternMatcher.matchesAny(candidate.text(), candidate.languageCode())) {
            factors.add(new Factor("pattern", PATTERN_BOOST));
        }
        if (isHeadingLike(candidate.text(), words)) {
            factors.add(new Factor("heading", HEADING_PENALTY));
        }
        if (numericRatio(candidate.tokens()) > NUMERIC_RATIO_LIMIT) {
            factors.add(new Factor("numeric", NUMERIC_PENALTY));
        }

        double score = 1.0;
        for (Factor factor : factors) {
            score *= factor.multiplier();
        }
        return new ScoreBreakdown(factors, Math.max(0.0, Math.min(1.0, score)));
    }

    /**
     * Applies the acceptance threshold; rejections are logged with their score.
     */
    public boolean accept(RequirementCandidate candidate, double score, double threshold) {
        if (score >= threshold) return true;
        log.info("Rejected candidate on page {} (confidence {} < {}): {}", candidate.page(),
                String.format(Locale.ROOT, "%.2f", score), threshold, abbreviate(candidate.text()));
        return false;
    }

    static double lengthFactor(int words) {
        if (words >= IDEAL_MIN_WORDS && words <= IDEAL_MAX_WORDS) return LENGTH_IDEAL;
        if ((words >= ACCEPTABLE_MIN_WORDS && words < IDEAL_MIN_WORDS)
                || (words > IDEAL_MAX_WORDS && words <= ACCEPTABLE_MAX_WORDS)) {
            return LENGTH_ACCEPTABLE;
        }
        return LENGTH_POOR;
    }

    static boolean isHeadingLike(String text, int words) {
        if (words <= HEADING_MAX_WORDS) return true;
        boolean hasLetter = text.codePoints().anyMatch(Character::isLetter);
        return hasLetter && text.equals(text.toUpperCase(Locale.ROOT));
    }

    static double numericRatio(List<String> tokens) {
        if (tokens.isEmpty()) return 0.0;
        long numeric = tokens.stream().filter(Tokenizer::isNumeric).count();
        return (double) numeric / tokens.size();
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 77) + "..." : text;
    }
}
