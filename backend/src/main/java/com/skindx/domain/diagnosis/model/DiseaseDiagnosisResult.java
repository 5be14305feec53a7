package com.skindx.domain.diagnosis.model;

import java.util.List;

/**
 * Stage 3 outcome. {@code requiresDoctorReview} is set whenever the diagnosis is a
 * fallback rather than a provider answer.
 */
public record DiseaseDiagnosisResult(
        String disease,
        LocalizedText diseaseName,
        double confidence,
        String severity,
        List<String> differentialDiagnoses,
        boolean requiresDoctorReview,
        String source,
        boolean fallbackUsed,
        long executionTimeMs,
        String timestamp
) implements StageResult {

    public static final String UNKNOWN_DISEASE = "unknown";

    public DiseaseDiagnosisResult {
        confidence = Confidence.clamp(confidence);
        differentialDiagnoses = differentialDiagnoses != null ? List.copyOf(differentialDiagnoses) : List.of();
    }
}
