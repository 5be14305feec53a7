package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Stage 1 outcome: normal or abnormal skin.
 *
 * @param note explains a defaulted classification, null otherwise
 */
public record ClassificationResult(
        Classification classification,
        double confidence,
        String note,
        String source,
        boolean fallbackUsed,
        long executionTimeMs,
        String timestamp
) implements StageResult {

    public ClassificationResult {
        confidence = Confidence.clamp(confidence);
    }

    @JsonIgnore
    public boolean isNormal() {
        return classification == Classification.NORMAL;
    }
}
