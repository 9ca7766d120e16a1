package com.example.reqbot.nlp;

/**
 * Thrown by a {@link SegmentationModelLoader} when a model cannot be loaded.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
