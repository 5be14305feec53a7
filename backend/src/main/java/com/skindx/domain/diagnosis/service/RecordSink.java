package com.skindx.domain.diagnosis.service;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.PipelineStage;
import com.skindx.domain.diagnosis.model.StageResult;

/**
 * Audit trail of a diagnosis run. Both calls are best-effort appends; an
 * implementation must not throw back into the pipeline.
 */
public interface RecordSink {

    void recordStage(String diagnosisId, PipelineStage stage, StageResult result);

    /**
     * @param error failure detail, null on success
     */
    void recordAiCall(String diagnosisId, AiTask task, String provider,
                      boolean success, long durationMs, String error);
}
