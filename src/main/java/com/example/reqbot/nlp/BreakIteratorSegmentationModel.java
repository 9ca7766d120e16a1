package com.example.reqbot.nlp;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Sentence boundaries from the JDK's locale-aware {@link BreakIterator}.
 */
public class BreakIteratorSegmentationModel implements SegmentationModel {

    private final String id;
    private final Locale locale;

    public BreakIteratorSegmentationModel(String id, Locale locale) {
        this.id = id;
        this.locale = locale;
    }

    @Override
    public String id() {
        return id;
    }

    public Locale locale() {
        return locale;
    }

    @Override
    public List<TextSpan> sentenceSpans(String paragraph) {
        // BreakIterator instances are stateful, one per call.
        BreakIterator iterator = BreakIterator.getSentenceInstance(locale);
        iterator.setText(paragraph);
        List<TextSpan> spans = new ArrayList<>();
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
            spans.add(new TextSpan(start, end));
        }
        return spans;
    }

    @Override
    public String toString() {
        return "BreakIterator[" + id + ", " + locale + "]";
    }
}
