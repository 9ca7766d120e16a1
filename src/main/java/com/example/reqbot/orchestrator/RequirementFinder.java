package com.example.reqbot.orchestrator;

import com.example.reqbot.config.ExtractionProperties;
import com.example.reqbot.language.LanguageDetector;
import com.example.reqbot.language.LanguageProfileStore;
import com.example.reqbot.model.DetectionResult;
import com.example.reqbot.model.ExtractionRequest;
import com.example.reqbot.model.ExtractionResult;
import com.example.reqbot.model.ExtractionStats;
import com.example.reqbot.model.LanguageProfile;
import com.example.reqbot.model.RequirementCandidate;
import com.example.reqbot.model.RequirementRecord;
import com.example.reqbot.nlp.Sentence;
import com.example.reqbot.nlp.SegmentationModelManager;
import com.example.reqbot.service.CandidateFilter;
import com.example.reqbot.service.ConfidenceScorer;
import com.example.reqbot.service.RequirementClassifier;
import com.example.reqbot.service.TextPreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Requirement extraction pipeline for one document.
 * Pipeline:
 * 1. Text preprocessing (every page)
 * 2. Language detection (once per document, on the leading pages)
 * 3. Language profile resolution and keyword profile merge
 * 4. Segmentation model lookup
 * 5. Per page: segmentation, keyword filtering, scoring, classification
 * <p>
 * A failure inside one page drops that page only; the rest of the document is still processed.
 */
@Service
public class RequirementFinder {

    private static final Logger log = LoggerFactory.getLogger(RequirementFinder.class);

    private final TextPreprocessor preprocessor;
    private final LanguageDetector detector;
    private final LanguageProfileStore profileStore;
    private final SegmentationModelManager modelManager;
    private final CandidateFilter candidateFilter;
    private final ConfidenceScorer scorer;
    private final RequirementClassifier classifier;
    private final ExtractionProperties properties;

    public RequirementFinder(TextPreprocessor preprocessor,
                             LanguageDetector detector,
                             LanguageProfileStore profileStore,
                             SegmentationModelManager modelManager,
                             CandidateFilter candidateFilter,
                             ConfidenceScorer scorer,
                             RequirementClassifier classifier,
                             ExtractionProperties properties) {
        this.preprocessor = preprocessor;
        this.detector = detector;
        this.profileStore = profileStore;
        this.modelManager = modelManager;
        this.candidateFilter = candidateFilter;
        this.scorer = scorer;
        this.classifier = classifier;
        this.properties = properties;
    }

    public ExtractionResult find(ExtractionRequest request) {
        String documentId = request.documentId();
        double threshold = request.confidenceThreshold() != null
                ? request.confidenceThreshold()
                : properties.scoring().confidenceThreshold();
        log.info("═══════════════════════════════════════════════");
        log.info("Extracting requirements from '{}' ({} pages, threshold {})",
                documentId, request.pages().size(), threshold);
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Preprocessing ──
        log.info("[1/5] Preprocessing {} pages...", request.pages().size());
        List<String> pages = request.pages().stream().map(preprocessor::preprocess).toList();

        // ── Step 2: Language ──
        DetectionResult detection = detectLanguage(request, pages);
        log.info("[2/5] Document language: '{}' (confidence {}{})", detection.languageCode(),
                String.format(Locale.ROOT, "%.2f", detection.confidence()),
                detection.lowConfidence() ? ", fallback" : "");

        // ── Step 3: Profile ──
        LanguageProfile profile = resolveProfile(detection.languageCode()).mergedWith(request.keywordProfile());
        if (!request.keywordProfile().isEmpty()) {
            log.info("[3/5] Keyword profile '{}' merged into '{}' ({} keywords)",
                    request.keywordProfile().name(), profile.code(), profile.keywords().size());
        } else {
            log.info("[3/5] Using '{}' profile ({} keywords)", profile.code(), profile.keywords().size());
        }

        // ── Step 4: Segmentation model ──
        if (!modelManager.isModelAvailable(profile.code())) {
            log.error("[4/5] No segmentation model for '{}', no requirements can be extracted", profile.code());
        } else {
            log.info("[4/5] Segmentation model ready for '{}'", profile.code());
        }

        // ── Step 5: Pages ──
        log.info("[5/5] Scanning pages...");
        Counters counters = new Counters();
        List<RequirementRecord> records = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            int pageNumber = i + 1;
            try {
                List<RequirementRecord> pageRecords =
                        processPage(documentId, pages.get(i), pageNumber, profile, threshold, records.size(), counters);
                records.addAll(pageRecords);
            } catch (RuntimeException e) {
                counters.pagesSkipped++;
                log.error("Page {} of '{}' skipped after a processing failure: {}", pageNumber, documentId, e.toString());
                log.debug("Page failure details", e);
            }
        }

        ExtractionStats stats = new ExtractionStats(pages.size(), counters.pagesSkipped, counters.sentences,
                counters.candidates, counters.rejected, records.size());
        log.info("═══════════════════════════════════════════════");
        log.info("'{}' completed: {} requirements ({} candidates, {} below threshold, {} pages skipped)",
                documentId, records.size(), stats.candidates(), stats.rejectedByConfidence(), stats.pagesSkipped());
        log.info("═══════════════════════════════════════════════");
        return new ExtractionResult(documentId, detection, records, stats);
    }

    private List<RequirementRecord> processPage(String documentId, String text, int pageNumber,
                                                LanguageProfile profile, double threshold,
                                                int emittedSoFar, Counters counters) {
        List<Sentence> sentences = modelManager.extractSentences(
                text, profile.code(), candidateFilter.minWords(), candidateFilter.maxWords());

        // Page-local counts are committed only when the whole page succeeds.
        int candidates = 0;
        int rejected = 0;
        List<RequirementRecord> pageRecords = new ArrayList<>();
        for (Sentence sentence : sentences) {
            Optional<RequirementCandidate> match = candidateFilter.filter(sentence, pageNumber, profile);
            if (match.isEmpty()) continue;
            candidates++;
            RequirementCandidate candidate = match.get();

            double confidence = scorer.score(candidate);
            if (!scorer.accept(candidate, confidence, threshold)) {
                rejected++;
                continue;
            }
            RequirementClassifier.Classification classification = classifier.classify(candidate, profile);
            int seq = emittedSoFar + pageRecords.size() + 1;
            pageRecords.add(new RequirementRecord(
                    label(documentId, pageNumber, seq),
                    candidate.text(),
                    pageNumber,
                    candidate.matchedKeyword(),
                    profile.code(),
                    confidence,
                    classification.priority(),
                    classification.category(),
                    candidate.tokens()));
        }
        counters.sentences += sentences.size();
        counters.candidates += candidates;
        counters.rejected += rejected;
        if (!pageRecords.isEmpty()) {
            log.debug("Page {}: {} requirements", pageNumber, pageRecords.size());
        }
        return pageRecords;
    }

    private DetectionResult detectLanguage(ExtractionRequest request, List<String> pages) {
        List<String> supported = profileStore.supportedLanguages();
        int samplePages = Math.min(pages.size(), properties.detection().samplePages());
        String sample = String.join("\n\n", pages.subList(0, samplePages));
        return detector.detectWithOverride(sample, request.languageHint(), supported);
    }

    private LanguageProfile resolveProfile(String languageCode) {
        for (String candidate : List.of(languageCode, profileStore.defaultLanguage())) {
            Optional<LanguageProfile> profile = profileStore.getProfile(candidate);
            if (profile.isPresent()) {
                if (!candidate.equals(languageCode)) {
                    log.warn("No profile for '{}', using '{}'", languageCode, candidate);
                }
                return profile.get();
            }
        }
        throw new IllegalStateException("Default language '" + profileStore.defaultLanguage() + "' has no profile");
    }

    static String label(String documentId, int page, int seq) {
        return documentId + "-Req#" + page + "-" + seq;
    }

    private static final class Counters {
        int pagesSkipped;
        int sentences;
        int candidates;
        int rejected;
    }
}
