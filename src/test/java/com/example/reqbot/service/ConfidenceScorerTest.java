package com.example.reqbot.service;

import com.example.reqbot.TestFixtures;
import com.example.reqbot.model.LanguageProfile;
import com.example.reqbot.model.RequirementCandidate;
import com.example.reqbot.nlp.Tokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    @TempDir
    Path tempDir;

    private LanguageProfile english;
    private ConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        var store = TestFixtures.profileStore(tempDir);
        english = store.getProfile("en").orElseThrow();
        scorer = new ConfidenceScorer(new RequirementPatternMatcher(store));
    }

    private RequirementCandidate candidate(String text) {
        List<String> tokens = Tokenizer.tokenize(text);
        List<String> keywords = CandidateFilter.matchKeywords(tokens, english.keywords());
        return new RequirementCandidate(text, 1, tokens, keywords.isEmpty() ? null : keywords.get(0),
                new LinkedHashSet<>(keywords), "en");
    }

    @Test
    void score_shortWellFormedRequirementShouldExceedSeventyPercent() {
        double score = scorer.score(candidate("The system shall provide user authentication."));

        // 6 words (0.7) with a modal pattern (1.3)
        assertThat(score).isCloseTo(0.91, within(1e-9));
    }

    @Test
    void score_shouldBeClampedToOne() {
        ConfidenceScorer.ScoreBreakdown breakdown = scorer.breakdown(candidate(
                "The system shall provide and must support encrypted backups for every operator."));

        assertThat(breakdown.factors()).extracting(ConfidenceScorer.Factor::name)
                .containsExactly("length", "keywords", "pattern");
        assertThat(breakdown.score()).isEqualTo(1.0);
    }

    @Test
    void score_shouldPenalizeUpperCaseHeadings() {
        ConfidenceScorer.ScoreBreakdown breakdown =
                scorer.breakdown(candidate("THE SYSTEM SHALL PROVIDE LOGGING SERVICES."));

        assertThat(breakdown.factors()).extracting(ConfidenceScorer.Factor::name).contains("heading");
        assertThat(breakdown.score()).isCloseTo(0.7 * 1.3 * 0.5, within(1e-9));
    }

    @Test
    void score_shouldPenalizeNumericRows() {
        ConfidenceScorer.ScoreBreakdown breakdown =
                scorer.breakdown(candidate("Table 4 shall 12 14 16 18 20 22 list values"));

        assertThat(breakdown.factors()).extracting(ConfidenceScorer.Factor::name)
                .containsExactly("length", "numeric");
        assertThat(breakdown.score()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void lengthFactor_shouldFollowWordBands() {
        assertThat(ConfidenceScorer.lengthFactor(4)).isEqualTo(ScoringWeights.LENGTH_POOR);
        assertThat(ConfidenceScorer.lengthFactor(5)).isEqualTo(ScoringWeights.LENGTH_ACCEPTABLE);
        assertThat(ConfidenceScorer.lengthFactor(7)).isEqualTo(ScoringWeights.LENGTH_ACCEPTABLE);
        assertThat(ConfidenceScorer.lengthFactor(8)).isEqualTo(ScoringWeights.LENGTH_IDEAL);
        assertThat(ConfidenceScorer.lengthFactor(50)).isEqualTo(ScoringWeights.LENGTH_IDEAL);
        assertThat(ConfidenceScorer.lengthFactor(51)).isEqualTo(ScoringWeights.LENGTH_ACCEPTABLE);
        assertThat(ConfidenceScorer.lengthFactor(80)).isEqualTo(ScoringWeights.LENGTH_ACCEPTABLE);
        assertThat(ConfidenceScorer.lengthFactor(81)).isEqualTo(ScoringWeights.LENGTH_POOR);
        assertThat(ConfidenceScorer.lengthFactor(100)).isEqualTo(ScoringWeights.LENGTH_POOR);
    }

    @Test
    void isHeadingLike_shouldFlagShortOrUpperCaseText() {
        assertThat(ConfidenceScorer.isHeadingLike("System overview", 2)).isTrue();
        assertThat(ConfidenceScorer.isHeadingLike("SAFETY REQUIREMENTS FOR THE PUMP", 5)).isTrue();
        assertThat(ConfidenceScorer.isHeadingLike("The pump shall stop when pressure drops.", 7)).isFalse();
        assertThat(ConfidenceScorer.isHeadingLike("12 34 56 78 90", 5)).isFalse();
    }

    @Test
    void score_shouldAlwaysStayWithinBounds() {
        List<String> texts = List.of(
                "The system shall provide user authentication.",
                "MUST MUST MUST SHALL SHALL",
                "1 2 3 4 5 shall 6 7 8 9",
                "The operator should, where practical, confirm each transfer within 30 seconds of the request.");

        for (String text : texts) {
            assertThat(scorer.score(candidate(text))).isBetween(0.0, 1.0);
        }
    }

    @Test
    void accept_shouldCompareAgainstThreshold() {
        RequirementCandidate candidate = candidate("The system shall provide user authentication.");

        assertThat(scorer.accept(candidate, 0.5, 0.5)).isTrue();
        assertThat(scorer.accept(candidate, 0.49, 0.5)).isFalse();
    }
}
