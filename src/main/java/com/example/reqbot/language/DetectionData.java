package com.example.reqbot.language;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Reference data of the language detector, read from {@code language-detection.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record DetectionData(
        @JsonProperty("version") int version,
        @JsonProperty("accented_chars") String accentedChars,
        @JsonProperty("languages") Map<String, LanguageData> languages
) {

    static final String RESOURCE = "/language-detection.json";

    DetectionData {
        accentedChars = accentedChars == null ? "" : accentedChars;
        languages = languages == null ? Map.of() : languages;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LanguageData(
            @JsonProperty("name") String name,
            @JsonProperty("special_chars") String specialChars,
            @JsonProperty("common_words") List<String> commonWords,
            @JsonProperty("requirement_keywords") List<String> requirementKeywords,
            @JsonProperty("trigrams") List<String> trigrams
    ) {
        LanguageData {
            specialChars = specialChars == null ? "" : specialChars;
            commonWords = commonWords == null ? List.of() : List.copyOf(commonWords);
            requirementKeywords = requirementKeywords == null ? List.of() : List.copyOf(requirementKeywords);
            trigrams = trigrams == null ? List.of() : List.copyOf(trigrams);
        }
    }

    static DetectionData fromClasspath(ObjectMapper mapper) {
        try (InputStream in = DetectionData.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return mapper.readValue(in, DetectionData.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
    }
}
