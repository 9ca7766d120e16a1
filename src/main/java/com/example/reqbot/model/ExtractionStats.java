package com.example.reqbot.model;

/**
 * Counters of one extraction run.
 *
 * @param pagesTotal           pages received
 * @param pagesSkipped         pages dropped after a processing failure
 * @param sentences            sentences kept by segmentation
 * @param candidates           sentences that matched a requirement keyword
 * @param rejectedByConfidence candidates below the confidence threshold
 * @param accepted             records emitted
 */
public record ExtractionStats(
        int pagesTotal,
        int pagesSkipped,
        int sentences,
        int candidates,
        int rejectedByConfidence,
        int accepted
) {}
