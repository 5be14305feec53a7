package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stage 0 outcome. When {@code valid} is false the pipeline stops here.
 *
 * @param rejectionReason set only for rejected images
 * @param userGuidance    bilingual advice shown with a rejection
 */
public record GateResult(
        @JsonProperty("is_valid") boolean valid,
        @JsonProperty("is_skin") boolean skin,
        @JsonProperty("is_medical") boolean medical,
        @JsonProperty("is_usable") boolean usable,
        double confidence,
        RejectionReason rejectionReason,
        LocalizedText userGuidance,
        String source,
        boolean fallbackUsed,
        long executionTimeMs,
        String timestamp
) implements StageResult {

    public static final String SOURCE_VALIDATION_FAILED = "validation_failed";

    public GateResult {
        confidence = Confidence.clamp(confidence);
    }

    public static GateResult accepted(boolean skin, boolean medical, boolean usable, double confidence,
                                      String provider, boolean fallbackUsed, long executionTimeMs, String timestamp) {
        return new GateResult(true, skin, medical, usable, confidence, null, null,
                provider, fallbackUsed, executionTimeMs, timestamp);
    }

    public static GateResult rejected(RejectionReason reason, long executionTimeMs, String timestamp) {
        return new GateResult(false, false, false, false, 0.0, reason, reason.guidance(),
                SOURCE_VALIDATION_FAILED, true, executionTimeMs, timestamp);
    }
}
