package com.example.reqbot.config;

import com.example.reqbot.language.LanguageDetector;
import com.example.reqbot.language.LanguageProfileStore;
import com.example.reqbot.nlp.BreakIteratorModelLoader;
import com.example.reqbot.nlp.ChainedModelLoader;
import com.example.reqbot.nlp.OpenNlpModelLoader;
import com.example.reqbot.nlp.SegmentationModelLoader;
import com.example.reqbot.nlp.SegmentationModelManager;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared engine components: language resources and segmentation models.
 * <p>
 * - languageProfileStore: keyword profiles backed by {@code reqbot.profiles.config-path}
 * - segmentationModelLoader: OpenNLP models (when {@code reqbot.segmentation.models-dir} is set), then JDK rules
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    /**
     * ObjectMapper shared by the profile store, the detector data and the REST layer.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public LanguageProfileStore languageProfileStore(ExtractionProperties properties, ObjectMapper objectMapper) {
        return new LanguageProfileStore(Path.of(properties.profiles().configPath()), objectMapper);
    }

    @Bean
    public LanguageDetector languageDetector(ExtractionProperties properties, ObjectMapper objectMapper,
                                             LanguageProfileStore languageProfileStore) {
        return new LanguageDetector(objectMapper, properties.detection(), languageProfileStore::defaultLanguage);
    }

    /**
     * Model loaders in evaluation order.
     */
    @Bean
    public SegmentationModelLoader segmentationModelLoader(ExtractionProperties properties) {
        List<SegmentationModelLoader> loaders = new ArrayList<>();
        String modelsDir = properties.segmentation().modelsDir();
        if (modelsDir != null && !modelsDir.isBlank()) {
            loaders.add(new OpenNlpModelLoader(Path.of(modelsDir)));
            log.info("OpenNLP sentence models enabled from {}", modelsDir);
        }
        loaders.add(new BreakIteratorModelLoader());
        return new ChainedModelLoader(loaders);
    }

    @Bean
    public SegmentationModelManager segmentationModelManager(LanguageProfileStore languageProfileStore,
                                                             SegmentationModelLoader segmentationModelLoader) {
        return new SegmentationModelManager(languageProfileStore, segmentationModelLoader);
    }
}
