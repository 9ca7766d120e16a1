package com.example.reqbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the requirement extraction engine.
 */
@ConfigurationProperties(prefix = "reqbot")
public record ExtractionProperties(
        @DefaultValue Profiles profiles,
        @DefaultValue Detection detection,
        @DefaultValue Segmentation segmentation,
        @DefaultValue Scoring scoring
) {

    /**
     * Language profile configuration file.
     *
     * @param configPath path of the JSON file; created with defaults if missing
     */
    public record Profiles(@DefaultValue("language_profiles.json") String configPath) {}

    /**
     * Language detection settings.
     *
     * @param sampleChars         characters of the document sample analysed
     * @param samplePages         leading pages joined into the sample
     * @param minTextLength       below this length the result is capped to low confidence
     * @param acceptanceThreshold minimum confidence for accepting a detected language; below it the profile
     *                            store's default language is used
     */
    public record Detection(
            @DefaultValue("5000") int sampleChars,
            @DefaultValue("3") int samplePages,
            @DefaultValue("60") int minTextLength,
            @DefaultValue("0.5") double acceptanceThreshold
    ) {}

    /**
     * Sentence segmentation settings.
     *
     * @param modelsDir directory holding OpenNLP sentence models ({@code <modelId>.bin}); blank disables OpenNLP
     * @param minWords  shortest sentence kept, in words
     * @param maxWords  longest sentence kept, in words
     */
    public record Segmentation(
            @DefaultValue("") String modelsDir,
            @DefaultValue("5") int minWords,
            @DefaultValue("100") int maxWords
    ) {}

    /**
     * Confidence scoring settings.
     *
     * @param confidenceThreshold default acceptance threshold when a request does not set one
     */
    public record Scoring(@DefaultValue("0.5") double confidenceThreshold) {}
}
