package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Placeholder for a stage the pipeline deliberately did not run.
 */
public record SkippedStage(String reason, String timestamp) implements StageResult {

    public static final String SOURCE = "pipeline_skip";
    public static final String NORMAL_CLASSIFICATION = "normal_classification";

    @JsonProperty("skipped")
    public boolean skipped() {
        return true;
    }

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public boolean fallbackUsed() {
        return false;
    }

    @Override
    public long executionTimeMs() {
        return 0;
    }
}
