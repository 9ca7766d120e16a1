package com.example.reqbot.service;

/**
 * Factor table of the requirement confidence heuristic. Every factor multiplies a score that starts at 1.0.
 */
public final class ScoringWeights {

    private ScoringWeights() {}

    // ── Length ──────────────────────────────────────────────────────────────
    /** Well-formed requirement sentences: 8 to 50 words. */
    public static final int IDEAL_MIN_WORDS = 8;
    public static final int IDEAL_MAX_WORDS = 50;
    /** Upper bound of the acceptable band; 5 to 7 words fall in it too. */
    public static final int ACCEPTABLE_MAX_WORDS = 80;
    public static final int ACCEPTABLE_MIN_WORDS = 5;

    public static final double LENGTH_IDEAL = 1.0;
    public static final double LENGTH_ACCEPTABLE = 0.7;
    public static final double LENGTH_POOR = 0.3;

    // ── Keyword density ─────────────────────────────────────────────────────
    public static final int DENSE_KEYWORD_COUNT = 2;
    public static final double KEYWORD_DENSITY_BOOST = 1.2;

    // ── Structural pattern ──────────────────────────────────────────────────
    public static final double PATTERN_BOOST = 1.3;

    // ── Heading ─────────────────────────────────────────────────────────────
    /** Sentences this short read as headings. */
    public static final int HEADING_MAX_WORDS = 4;
    public static final double HEADING_PENALTY = 0.5;

    // ── Numeric density ─────────────────────────────────────────────────────
    /** Share of purely numeric tokens above which a sentence is treated as table data. */
    public static final double NUMERIC_RATIO_LIMIT = 0.3;
    public static final double NUMERIC_PENALTY = 0.6;
}
