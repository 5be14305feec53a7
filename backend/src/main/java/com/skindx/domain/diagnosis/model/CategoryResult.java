package com.skindx.domain.diagnosis.model;

/**
 * Stage 2 outcome.
 */
public record CategoryResult(
        DiseaseCategory category,
        String subcategory,
        double confidence,
        String source,
        boolean fallbackUsed,
        long executionTimeMs,
        String timestamp
) implements StageResult {

    public CategoryResult {
        confidence = Confidence.clamp(confidence);
    }
}
