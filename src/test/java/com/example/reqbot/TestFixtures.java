package com.example.reqbot;

import com.example.reqbot.config.ExtractionProperties;
import com.example.reqbot.language.LanguageProfileStore;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;

/**
 * Shared builders for unit tests.
 */
public final class TestFixtures {

    private TestFixtures() {}

    public static ExtractionProperties properties() {
        return new ExtractionProperties(
                new ExtractionProperties.Profiles("language_profiles.json"),
                new ExtractionProperties.Detection(5000, 3, 60, 0.5),
                new ExtractionProperties.Segmentation("", 5, 100),
                new ExtractionProperties.Scoring(0.5));
    }

    /** Store backed by a fresh file in {@code dir}, populated with the bundled defaults on first use. */
    public static LanguageProfileStore profileStore(Path dir) {
        return new LanguageProfileStore(dir.resolve("language_profiles.json"), new ObjectMapper());
    }
}
