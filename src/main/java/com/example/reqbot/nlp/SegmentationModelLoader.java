package com.example.reqbot.nlp;

/**
 * Loads the sentence-boundary model of one language.
 */
public interface SegmentationModelLoader {

    /**
     * @param languageCode ISO 639-1 code of the language
     * @param modelId      model identifier from the language profile
     * @throws ModelUnavailableException if the model cannot be loaded
     */
    SegmentationModel load(String languageCode, String modelId);
}
