package com.example.reqbot.nlp;

import opennlp.tools.sentdetect.SentenceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads OpenNLP sentence models from {@code <modelsDir>/<modelId>.bin}.
 */
public class OpenNlpModelLoader implements SegmentationModelLoader {

    private static final Logger log = LoggerFactory.getLogger(OpenNlpModelLoader.class);

    private final Path modelsDir;

    public OpenNlpModelLoader(Path modelsDir) {
        this.modelsDir = modelsDir;
    }

    @Override
    public SegmentationModel load(String languageCode, String modelId) {
        Path file = modelsDir.resolve(modelId + ".bin");
        if (!Files.isRegularFile(file)) {
            throw new ModelUnavailableException("OpenNLP model file not found: " + file);
        }
        long start = System.currentTimeMillis();
        try (InputStream in = Files.newInputStream(file)) {
            SentenceModel model = new SentenceModel(in);
            log.info("Loaded OpenNLP sentence model '{}' for '{}' in {}ms",
                    modelId, languageCode, System.currentTimeMillis() - start);
            return new OpenNlpSegmentationModel(modelId, model);
        } catch (IOException | RuntimeException e) {
            // Corrupt archives surface as either kind.
            throw new ModelUnavailableException("Unable to read OpenNLP model " + file + ": " + e.getMessage(), e);
        }
    }
}
