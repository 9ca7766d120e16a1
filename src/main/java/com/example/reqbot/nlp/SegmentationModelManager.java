package com.example.reqbot.nlp;

import com.example.reqbot.language.LanguageProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lazily loads, caches and releases sentence segmentation models, one per language.
 * <p>
 * Cache hits are lock-free. A miss takes the manager lock, re-checks the cache and walks the fallback
 * chain {@code [requested language, default language]}, so concurrent first requests for one language
 * trigger a single load and observe the same instance. Failed loads are remembered and not retried until
 * {@link #unloadAll()}.
 */
public class SegmentationModelManager {

    private static final Logger log = LoggerFactory.getLogger(SegmentationModelManager.class);

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n\\s*");

    private final LanguageProfileStore profileStore;
    private final SegmentationModelLoader loader;
    private final Map<String, SegmentationModel> models = new ConcurrentHashMap<>();
    private final Set<String> failedLoads = new HashSet<>();
    private final Object lock = new Object();

    public SegmentationModelManager(LanguageProfileStore profileStore, SegmentationModelLoader loader) {
        this.profileStore = profileStore;
        this.loader = loader;
    }

    /**
     * Returns the model for {@code languageCode}, falling back to the default language's model.
     * Empty if neither can be loaded.
     */
    public Optional<SegmentationModel> getModel(String languageCode) {
        String code = normalize(languageCode);
        SegmentationModel cached = models.get(code);
        if (cached != null) {
            return Optional.of(cached);
        }
        synchronized (lock) {
            cached = models.get(code);
            if (cached != null) {
                return Optional.of(cached);
            }
            for (String candidate : fallbackChain(code)) {
                SegmentationModel model = tryLoad(candidate);
                if (model != null) {
                    if (!candidate.equals(code)) {
                        log.warn("Using '{}' segmentation model for '{}'", candidate, code);
                    }
                    models.putIfAbsent(candidate, model);
                    models.put(code, model);
                    return Optional.of(model);
                }
            }
            log.error("No segmentation model available for '{}'", code);
            return Optional.empty();
        }
    }

    public boolean isModelAvailable(String languageCode) {
        return getModel(languageCode).isPresent();
    }

    /** Language codes with a cached model. */
    public Set<String> loadedModels() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(models.keySet()));
    }

    public boolean isLoaded(String languageCode) {
        return models.containsKey(normalize(languageCode));
    }

    /**
     * Releases the model cached for {@code languageCode}. Every other language served by the same
     * fallback instance is released with it.
     */
    public void unload(String languageCode) {
        synchronized (lock) {
            SegmentationModel removed = models.remove(normalize(languageCode));
            if (removed == null) return;
            List<String> aliases = new ArrayList<>();
            models.forEach((code, model) -> {
                if (model == removed) aliases.add(code);
            });
            aliases.forEach(models::remove);
            log.info("Unloaded segmentation model '{}' for '{}'{}", removed.id(), languageCode,
                    aliases.isEmpty() ? "" : " and fallback users " + aliases);
        }
    }

    /** Releases every cached model and forgets failed load attempts. */
    public void unloadAll() {
        synchronized (lock) {
            int count = models.size();
            models.clear();
            failedLoads.clear();
            log.info("Unloaded {} segmentation models", count);
        }
    }

    /**
     * Segments {@code text} into sentences of {@code [minWords, maxWords]} words.
     * <p>
     * Blank lines are hard paragraph boundaries; single line breaks inside a paragraph are read as spaces.
     * Offsets refer to {@code text}. Returns an empty list when no model is available.
     */
    public List<Sentence> extractSentences(String text, String languageCode, int minWords, int maxWords) {
        if (text == null || text.isBlank()) return List.of();
        Optional<SegmentationModel> model = getModel(languageCode);
        if (model.isEmpty()) {
            log.warn("Skipping segmentation for '{}': no model", languageCode);
            return List.of();
        }

        List<Sentence> sentences = new ArrayList<>();
        int tooShort = 0;
        int tooLong = 0;
        int paragraphStart = 0;
        Matcher breaks = PARAGRAPH_BREAK.matcher(text);
        while (true) {
            boolean found = breaks.find();
            int paragraphEnd = found ? breaks.start() : text.length();
            String paragraph = text.substring(paragraphStart, paragraphEnd).replace('\n', ' ');
            for (TextSpan span : model.get().sentenceSpans(paragraph)) {
                int start = span.start();
                int end = span.end();
                while (start < end && Character.isWhitespace(paragraph.charAt(start))) start++;
                while (end > start && Character.isWhitespace(paragraph.charAt(end - 1))) end--;
                if (start == end) continue;

                String sentenceText = paragraph.substring(start, end);
                List<String> tokens = Tokenizer.tokenize(sentenceText);
                if (tokens.size() < minWords) {
                    tooShort++;
                    continue;
                }
                if (tokens.size() > maxWords) {
                    tooLong++;
                    log.debug("Sentence of {} words exceeds {} words, skipped", tokens.size(), maxWords);
                    continue;
                }
                sentences.add(new Sentence(sentenceText, paragraphStart + start, paragraphStart + end, tokens));
            }
            if (!found) break;
            paragraphStart = breaks.end();
        }
        if (tooShort + tooLong > 0) {
            log.debug("Segmentation '{}': {} sentences kept, {} too short, {} too long",
                    languageCode, sentences.size(), tooShort, tooLong);
        }
        return List.copyOf(sentences);
    }

    private List<String> fallbackChain(String code) {
        List<String> chain = new ArrayList<>();
        chain.add(code);
        String defaultLanguage = profileStore.defaultLanguage();
        if (!defaultLanguage.equals(code)) {
            chain.add(defaultLanguage);
        }
        return chain;
    }

    private SegmentationModel tryLoad(String code) {
        SegmentationModel shared = models.get(code);
        if (shared != null) {
            return shared;
        }
        if (failedLoads.contains(code)) {
            log.debug("Not retrying failed model load for '{}'", code);
            return null;
        }
        Optional<String> modelId = profileStore.getModelId(code);
        if (modelId.isEmpty()) {
            log.warn("No segmentation model configured for '{}'", code);
            failedLoads.add(code);
            return null;
        }
        try {
            SegmentationModel model = loader.load(code, modelId.get());
            log.info("Segmentation model '{}' loaded for '{}' ({})", modelId.get(), code, model);
            return model;
        } catch (ModelUnavailableException e) {
            log.warn("Segmentation model '{}' unavailable for '{}': {}", modelId.get(), code, e.getMessage());
            failedLoads.add(code);
            return null;
        }
    }

    private static String normalize(String languageCode) {
        return languageCode == null ? "" : languageCode.trim().toLowerCase(Locale.ROOT);
    }
}
