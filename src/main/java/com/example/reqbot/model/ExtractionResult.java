package com.example.reqbot.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Requirements extracted from one document, in page and sentence order.
 */
public record ExtractionResult(
        String documentId,
        DetectionResult detection,
        List<RequirementRecord> records,
        ExtractionStats stats
) {
    public ExtractionResult {
        records = List.copyOf(records);
    }

    public Map<Priority, Long> priorityDistribution() {
        return records.stream()
                .collect(Collectors.groupingBy(RequirementRecord::priority, Collectors.counting()));
    }

    public Map<Category, Long> categoryDistribution() {
        return records.stream()
                .collect(Collectors.groupingBy(RequirementRecord::category, Collectors.counting()));
    }
}
