package com.skindx.domain.diagnosis.model;

import java.util.List;

/**
 * Stage 4 outcome: the final verdict shown to the patient.
 */
public record FusionResult(
        String finalDiagnosis,
        double finalConfidence,
        String severity,
        String urgency,
        LocalizedText explanation,
        List<LocalizedText> recommendations,
        String followUp,
        List<String> sourcesUsed,
        String source,
        boolean fallbackUsed,
        long executionTimeMs,
        String timestamp
) implements StageResult {

    public FusionResult {
        finalConfidence = Confidence.clamp(finalConfidence);
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
        sourcesUsed = sourcesUsed != null ? List.copyOf(sourcesUsed) : List.of();
    }
}
