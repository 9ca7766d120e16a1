package com.example.reqbot.nlp;

/**
 * Half-open character range {@code [start, end)} of a sentence inside a paragraph.
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }
}
