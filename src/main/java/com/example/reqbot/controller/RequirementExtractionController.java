package com.example.reqbot.controller;

import com.example.reqbot.language.LanguageProfileStore;
import com.example.reqbot.model.ExtractionRequest;
import com.example.reqbot.model.ExtractionResult;
import com.example.reqbot.nlp.SegmentationModelManager;
import com.example.reqbot.orchestrator.RequirementFinder;
import com.example.reqbot.service.RequirementPatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for requirement extraction from page texts.
 */
@RestController
@RequestMapping("/api")
public class RequirementExtractionController {

    private static final Logger log = LoggerFactory.getLogger(RequirementExtractionController.class);

    private final RequirementFinder finder;
    private final LanguageProfileStore profileStore;
    private final SegmentationModelManager modelManager;
    private final RequirementPatternMatcher patternMatcher;

    public RequirementExtractionController(RequirementFinder finder,
                                           LanguageProfileStore profileStore,
                                           SegmentationModelManager modelManager,
                                           RequirementPatternMatcher patternMatcher) {
        this.finder = finder;
        this.profileStore = profileStore;
        this.modelManager = modelManager;
        this.patternMatcher = patternMatcher;
    }

    /**
     * Extracts requirements from the given page texts.
     *
     * <p>Endpoint: POST /api/requirements
     * <p>Content-Type: application/json
     */
    @PostMapping(value = "/requirements", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> extract(@RequestBody ExtractionApiRequest body) {
        // ── Input validation ──
        ExtractionRequest request;
        try {
            request = body.toExtractionRequest();
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }

        log.info("Received extraction request for '{}' ({} pages)", request.documentId(), request.pages().size());
        long start = System.currentTimeMillis();
        try {
            ExtractionResult result = finder.find(request);
            double seconds = (System.currentTimeMillis() - start) / 1000.0;
            return ResponseEntity.ok()
                    .header("X-Extraction-Seconds", String.valueOf(seconds))
                    .header("X-Requirements-Count", String.valueOf(result.records().size()))
                    .body(result);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error during extraction of '{}'", request.documentId(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during extraction",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Lists supported languages with their segmentation model and whether it is loaded.
     *
     * <p>Endpoint: GET /api/languages
     */
    @GetMapping("/languages")
    public ResponseEntity<List<Map<String, Object>>> languages() {
        List<Map<String, Object>> languages = profileStore.supportedLanguages().stream()
                .map(code -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("code", code);
                    profileStore.getProfile(code).ifPresent(p -> {
                        entry.put("name", p.name());
                        entry.put("modelId", p.modelId());
                        entry.put("keywords", p.keywords().size());
                    });
                    entry.put("default", code.equals(profileStore.defaultLanguage()));
                    entry.put("modelLoaded", modelManager.isLoaded(code));
                    return entry;
                })
                .toList();
        return ResponseEntity.ok(languages);
    }

    /**
     * Re-reads the language profile file and releases cached models and patterns.
     *
     * <p>Endpoint: POST /api/languages/reload
     */
    @PostMapping("/languages/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        profileStore.reload();
        patternMatcher.clearCache();
        modelManager.unloadAll();
        log.info("Language profiles reloaded: {}", profileStore.supportedLanguages());
        return ResponseEntity.ok(Map.of(
                "status", "reloaded",
                "languages", profileStore.supportedLanguages()
        ));
    }

    /**
     * Engine status.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "reqbot-engine",
                "languages", profileStore.supportedLanguages(),
                "loadedModels", modelManager.loadedModels(),
                "timestamp", Instant.now()
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
