package com.skindx.application.diagnosis;

import com.skindx.domain.diagnosis.model.DiagnosisStatus;
import com.skindx.domain.diagnosis.model.PipelineResult;

/**
 * @param specialty reviewing specialty, set only for {@link DiagnosisStatus#AWAITING_REVIEW}
 */
public record DiagnosisOutcome(
        String diagnosisId,
        DiagnosisStatus status,
        PipelineResult result,
        String specialty
) {}
