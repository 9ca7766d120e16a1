package com.example.reqbot.service;

import com.example.reqbot.config.ExtractionProperties;
import com.example.reqbot.model.LanguageProfile;
import com.example.reqbot.model.RequirementCandidate;
import com.example.reqbot.nlp.Sentence;
import com.example.reqbot.nlp.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns segmented sentences into {@link RequirementCandidate}s.
 * <p>
 * A sentence qualifies when its word count is within bounds and at least one profile keyword occurs as a
 * whole token, or as a consecutive token sequence for multi-word keywords. Substrings never match, so
 * "Marshall" does not contain "shall".
 */
@Service
public class CandidateFilter {

    private static final Logger log = LoggerFactory.getLogger(CandidateFilter.class);

    private final int minWords;
    private final int maxWords;

    @Autowired
    public CandidateFilter(ExtractionProperties properties) {
        this(properties.segmentation().minWords(), properties.segmentation().maxWords());
    }

    public CandidateFilter(int minWords, int maxWords) {
        if (minWords < 1 || maxWords < minWords) {
            throw new IllegalArgumentException("Invalid word bounds [" + minWords + ", " + maxWords + "]");
        }
        this.minWords = minWords;
        this.maxWords = maxWords;
    }

    public int minWords() {
        return minWords;
    }

    public int maxWords() {
        return maxWords;
    }

    public boolean hasValidLength(int wordCount) {
        return wordCount >= minWords && wordCount <= maxWords;
    }

    /**
     * Returns the candidate built from {@code sentence}, or empty when its length is out of bounds or no
     * keyword of {@code profile} occurs in it.
     */
    public Optional<RequirementCandidate> filter(Sentence sentence, int page, LanguageProfile profile) {
        int words = sentence.wordCount();
        if (!hasValidLength(words)) {
            log.debug("Rejected sentence on page {}: {} words outside [{}, {}]", page, words, minWords, maxWords);
            return Optional.empty();
        }
        List<String> matches = matchKeywords(sentence.tokens(), profile.keywords());
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RequirementCandidate(
                sentence.text(), page, sentence.tokens(), matches.get(0),
                new LinkedHashSet<>(matches), profile.code()));
    }

    /**
     * Distinct keywords occurring in {@code tokens}, ordered by first position in the sentence. At the
     * same position the longer keyword comes first.
     */
    public static List<String> matchKeywords(List<String> tokens, Set<String> keywords) {
        record Hit(String keyword, int index, int length) {}
        List<Hit> hits = new ArrayList<>();
        for (String keyword : keywords) {
            int index = Tokenizer.indexOf(tokens, keyword);
            if (index >= 0) {
                hits.add(new Hit(keyword, index, Tokenizer.tokenize(keyword).size()));
            }
        }
        hits.sort(Comparator.comparingInt(Hit::index).thenComparing(Hit::length, Comparator.reverseOrder()));
        return hits.stream().map(Hit::keyword).toList();
    }
}
