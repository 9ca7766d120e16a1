package com.example.reqbot.nlp;

import opennlp.tools.sentdetect.SentenceDetectorME;
import opennlp.tools.sentdetect.SentenceModel;
import opennlp.tools.util.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Sentence boundaries from a trained Apache OpenNLP {@link SentenceModel}.
 */
public class OpenNlpSegmentationModel implements SegmentationModel {

    private final String id;
    private final SentenceModel model;

    public OpenNlpSegmentationModel(String id, SentenceModel model) {
        this.id = id;
        this.model = model;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<TextSpan> sentenceSpans(String paragraph) {
        // SentenceModel is thread-safe, SentenceDetectorME is not.
        SentenceDetectorME detector = new SentenceDetectorME(model);
        Span[] spans = detector.sentPosDetect(paragraph);
        List<TextSpan> result = new ArrayList<>(spans.length);
        for (Span span : spans) {
            result.add(new TextSpan(span.getStart(), span.getEnd()));
        }
        return result;
    }

    @Override
    public String toString() {
        return "OpenNLP[" + id + "]";
    }
}
