package com.skindx.domain.diagnosis.model;

public enum PipelineStage {
    STAGE0("stage0"),
    STAGE1("stage1"),
    STAGE2("stage2"),
    STAGE3("stage3"),
    STAGE4("stage4");

    private final String recordName;

    PipelineStage(String recordName) {
        this.recordName = recordName;
    }

    public String recordName() {
        return recordName;
    }
}
