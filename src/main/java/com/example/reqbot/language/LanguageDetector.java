package com.example.reqbot.language;

import com.example.reqbot.config.ExtractionProperties;
import com.example.reqbot.model.DetectionResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Offline, deterministic document language identifier.
 * <p>
 * Each candidate language gets a weighted composite of four sub-scores computed on the lower-cased
 * leading sample of the text:
 * <ol>
 *   <li>special-character frequency (30)</li>
 *   <li>common-word overlap (40)</li>
 *   <li>requirement-keyword density (20)</li>
 *   <li>character-trigram overlap (10)</li>
 * </ol>
 * The best language wins; ties keep the earlier language of the candidate list. A best score below the
 * acceptance threshold falls back to the default language and is flagged as low confidence. The default
 * language is read on every call, so it follows profile reloads.
 */
public class LanguageDetector {

    private static final Logger log = LoggerFactory.getLogger(LanguageDetector.class);

    static final double WEIGHT_SPECIAL_CHARS = 30.0;
    static final double WEIGHT_COMMON_WORDS = 40.0;
    static final double WEIGHT_KEYWORDS = 20.0;
    static final double WEIGHT_TRIGRAMS = 10.0;

    /** Confidence ceiling for texts too short to be reliable. */
    static final double SHORT_TEXT_CAP = 0.3;

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<String, LanguageScorer> scorers;
    private final ExtractionProperties.Detection settings;
    private final Supplier<String> defaultLanguage;

    public LanguageDetector(ObjectMapper objectMapper, ExtractionProperties.Detection settings,
                            Supplier<String> defaultLanguage) {
        this(DetectionData.fromClasspath(objectMapper), settings, defaultLanguage);
    }

    LanguageDetector(DetectionData data, ExtractionProperties.Detection settings, Supplier<String> defaultLanguage) {
        this.settings = settings;
        this.defaultLanguage = defaultLanguage;
        Set<Integer> accented = codePoints(data.accentedChars());
        Map<String, LanguageScorer> built = new LinkedHashMap<>();
        data.languages().forEach((code, language) ->
                built.put(code.toLowerCase(Locale.ROOT), new LanguageScorer(language, accented)));
        this.scorers = built;
        log.info("Language detector ready for {} languages: {}", scorers.size(), scorers.keySet());
    }

    /**
     * Languages for which reference data is available.
     */
    public Set<String> knownLanguages() {
        return scorers.keySet();
    }

    /**
     * Detects the language of {@code text} among {@code supportedCodes}, evaluated in iteration order.
     * Codes without reference data are skipped.
     */
    public DetectionResult detect(String text, Collection<String> supportedCodes) {
        String fallback = defaultLanguage.get();
        if (text == null || text.isBlank()) {
            log.warn("Language detection on empty text, using default language '{}'", fallback);
            return new DetectionResult(fallback, 0.0, true);
        }

        String sample = text.length() > settings.sampleChars()
                ? text.substring(0, settings.sampleChars())
                : text;
        sample = sample.toLowerCase(Locale.ROOT);
        List<String> words = words(sample);

        String bestCode = null;
        double bestScore = -1.0;
        for (String code : supportedCodes) {
            LanguageScorer scorer = scorers.get(code.toLowerCase(Locale.ROOT));
            if (scorer == null) continue;
            double score = scorer.score(sample, words);
            log.debug("Language score {}={}", code, String.format(Locale.ROOT, "%.4f", score));
            if (score > bestScore) {
                bestScore = score;
                bestCode = code;
            }
        }
        if (bestCode == null) {
            log.warn("No reference data for any of {}, using default language '{}'", supportedCodes, fallback);
            return new DetectionResult(fallback, 0.0, true);
        }

        double confidence = Math.max(0.0, Math.min(1.0, bestScore));
        if (text.strip().length() < settings.minTextLength()) {
            confidence = Math.min(confidence, SHORT_TEXT_CAP);
        }
        if (confidence < settings.acceptanceThreshold()) {
            log.warn("Low-confidence language detection: best '{}' at {}, falling back to '{}'",
                    bestCode, String.format(Locale.ROOT, "%.2f", confidence), fallback);
            return new DetectionResult(fallback, confidence, true);
        }
        log.info("Detected language '{}' (confidence {})", bestCode, String.format(Locale.ROOT, "%.2f", confidence));
        return new DetectionResult(bestCode, confidence, false);
    }

    /**
     * Uses {@code override} with confidence 1.0 when it is one of {@code supportedCodes};
     * otherwise ignores it and detects.
     */
    public DetectionResult detectWithOverride(String text, String override, Collection<String> supportedCodes) {
        if (override != null && !override.isBlank()) {
            String code = override.trim().toLowerCase(Locale.ROOT);
            if (supportedCodes.contains(code)) {
                return DetectionResult.forced(code);
            }
            log.warn("Language override '{}' is not supported, detecting instead", override);
        }
        return detect(text, supportedCodes);
    }

    static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    private static Set<Integer> codePoints(String chars) {
        Set<Integer> result = new HashSet<>();
        chars.toLowerCase(Locale.ROOT).codePoints().forEach(result::add);
        return result;
    }

    /** Pre-built reference sets of one language. */
    private static final class LanguageScorer {

        private final Set<Integer> specialChars;
        private final Set<Integer> accentedChars;
        private final Set<String> commonWords;
        private final List<Pattern> keywordPatterns;
        private final Set<String> trigrams;

        LanguageScorer(DetectionData.LanguageData data, Set<Integer> accentedChars) {
            this.specialChars = codePoints(data.specialChars());
            this.accentedChars = accentedChars;
            this.commonWords = Set.copyOf(data.commonWords());
            this.keywordPatterns = data.requirementKeywords().stream()
                    .map(kw -> Pattern.compile("\\b" + Pattern.quote(kw.toLowerCase(Locale.ROOT)) + "\\b",
                            Pattern.UNICODE_CHARACTER_CLASS))
                    .toList();
            this.trigrams = Set.copyOf(data.trigrams());
        }

        double score(String sample, List<String> words) {
            double total = specialCharScore(sample) * WEIGHT_SPECIAL_CHARS
                    + commonWordScore(words) * WEIGHT_COMMON_WORDS
                    + keywordScore(sample) * WEIGHT_KEYWORDS
                    + trigramScore(sample) * WEIGHT_TRIGRAMS;
            return total / 100.0;
        }

        private double specialCharScore(String sample) {
            int length = sample.length();
            if (specialChars.isEmpty()) {
                // Languages without special characters score by the absence of accents.
                long accented = sample.codePoints().filter(accentedChars::contains).count();
                return Math.max(0.0, 1.0 - (double) accented / length * 20);
            }
            long count = sample.codePoints().filter(specialChars::contains).count();
            return Math.min(1.0, (double) count / length * 100);
        }

        private double commonWordScore(List<String> words) {
            if (words.isEmpty()) return 0.0;
            long common = words.stream().filter(commonWords::contains).count();
            return (double) common / words.size();
        }

        private double keywordScore(String sample) {
            int matches = 0;
            for (Pattern pattern : keywordPatterns) {
                Matcher m = pattern.matcher(sample);
                while (m.find()) {
                    matches++;
                }
            }
            return Math.min(1.0, matches / (sample.length() / 1000.0) * 0.5);
        }

        private double trigramScore(String sample) {
            int count = sample.length() - 2;
            if (trigrams.isEmpty() || count <= 0) return 0.5;
            int hits = 0;
            for (int i = 0; i < count; i++) {
                if (trigrams.contains(sample.substring(i, i + 3))) {
                    hits++;
                }
            }
            return (double) hits / count;
        }
    }
}
