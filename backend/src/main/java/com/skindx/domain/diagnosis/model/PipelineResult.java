package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Aggregate outcome of one diagnosis run. Stage slots stay null for stages that
 * were never reached.
 *
 * @param stage2 a {@link CategoryResult} or a {@link SkippedStage}
 * @param stage3 a {@link DiseaseDiagnosisResult} or a {@link SkippedStage}
 */
public record PipelineResult(
        boolean success,
        GateResult stage0,
        ClassificationResult stage1,
        StageResult stage2,
        StageResult stage3,
        FusionResult stage4,
        String error,
        long totalDurationMs
) {

    public PipelineResult {
        if (success && (stage0 == null || !stage0.valid())) {
            throw new IllegalStateException("Pipeline cannot succeed without a passed validation gate");
        }
        if (stage1 != null && stage1.isNormal()
                && (isRealResult(stage2) || isRealResult(stage3))) {
            throw new IllegalStateException("Normal classification must not carry stage 2/3 results");
        }
    }

    private static boolean isRealResult(StageResult result) {
        return result != null && !(result instanceof SkippedStage);
    }

    @JsonIgnore
    public boolean rejectedByGate() {
        return stage0 != null && !stage0.valid();
    }
}
