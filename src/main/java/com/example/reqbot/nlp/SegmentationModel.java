package com.example.reqbot.nlp;

import java.util.List;

/**
 * A loaded sentence-boundary model for one language. Implementations are safe for concurrent use.
 */
public interface SegmentationModel {

    /** Model identifier, as configured in the language profile. */
    String id();

    /** Sentence boundaries of a single paragraph, in order. */
    List<TextSpan> sentenceSpans(String paragraph);
}
