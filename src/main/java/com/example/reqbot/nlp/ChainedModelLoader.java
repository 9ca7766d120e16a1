package com.example.reqbot.nlp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tries its loaders in order and returns the first model that loads.
 */
public class ChainedModelLoader implements SegmentationModelLoader {

    private static final Logger log = LoggerFactory.getLogger(ChainedModelLoader.class);

    private final List<SegmentationModelLoader> loaders;

    public ChainedModelLoader(List<SegmentationModelLoader> loaders) {
        if (loaders == null || loaders.isEmpty()) {
            throw new IllegalArgumentException("At least one model loader is required");
        }
        this.loaders = List.copyOf(loaders);
    }

    @Override
    public SegmentationModel load(String languageCode, String modelId) {
        ModelUnavailableException failure =
                new ModelUnavailableException("No loader could provide model '" + modelId + "' for '" + languageCode + "'");
        for (SegmentationModelLoader loader : loaders) {
            try {
                return loader.load(languageCode, modelId);
            } catch (ModelUnavailableException e) {
                log.debug("{} failed for '{}': {}", loader.getClass().getSimpleName(), languageCode, e.getMessage());
                failure.addSuppressed(e);
            }
        }
        throw failure;
    }

    public List<SegmentationModelLoader> loaders() {
        return loaders;
    }
}
