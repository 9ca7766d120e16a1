package com.example.reqbot.nlp;

import java.text.BreakIterator;
import java.util.Arrays;
import java.util.Locale;

/**
 * Builds {@link BreakIteratorSegmentationModel}s for any language the JDK has sentence rules for.
 */
public class BreakIteratorModelLoader implements SegmentationModelLoader {

    @Override
    public SegmentationModel load(String languageCode, String modelId) {
        Locale locale = Locale.forLanguageTag(languageCode);
        if (locale.getLanguage().isEmpty()) {
            throw new ModelUnavailableException("'" + languageCode + "' is not a valid language tag");
        }
        boolean available = Arrays.stream(BreakIterator.getAvailableLocales())
                .anyMatch(l -> l.getLanguage().equals(locale.getLanguage()));
        if (!available) {
            throw new ModelUnavailableException("No JDK sentence rules for language '" + languageCode + "'");
        }
        return new BreakIteratorSegmentationModel(modelId, locale);
    }
}
