package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.*;
import lombok.Data;

import java.util.Map;

/**
 * Mutable context object passed through pipeline stages.
 * Accumulates results from each stage for the next.
 */
@Data
public class DiagnosisPipelineContext {

    // --- Input ---
    private String diagnosisId;
    private String imagePath;
    private byte[] imageBytes;
    private Map<String, Object> patientData;

    // --- Stage outputs ---
    private GateResult stage0;
    private ClassificationResult stage1;
    private StageResult stage2;
    private StageResult stage3;
    private FusionResult stage4;

    // --- Outcome ---
    private boolean success;
    private String error;
    private long startedAtMs;
    private long totalDurationMs;

    /**
     * Category result for fusion, null when stage 2 was skipped or never ran.
     */
    public CategoryResult categoryResult() {
        return stage2 instanceof CategoryResult category ? category : null;
    }

    public DiseaseDiagnosisResult diagnosisResult() {
        return stage3 instanceof DiseaseDiagnosisResult diagnosis ? diagnosis : null;
    }

    /**
     * Build the final PipelineResult from accumulated context.
     */
    public PipelineResult toPipelineResult() {
        return new PipelineResult(success, stage0, stage1, stage2, stage3, stage4, error, totalDurationMs);
    }
}
