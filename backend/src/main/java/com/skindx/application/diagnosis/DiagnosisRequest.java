package com.skindx.application.diagnosis;

import java.util.Map;

/**
 * One image submitted for diagnosis. At least one of {@code imageBytes} and
 * {@code imagePath} must be present.
 *
 * @param doctorReviewRequested patient asked for a doctor to review the result
 */
public record DiagnosisRequest(
        String diagnosisId,
        String imagePath,
        byte[] imageBytes,
        Map<String, Object> patientData,
        boolean doctorReviewRequested
) {}
