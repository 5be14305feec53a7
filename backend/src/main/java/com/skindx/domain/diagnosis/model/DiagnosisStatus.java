package com.skindx.domain.diagnosis.model;

public enum DiagnosisStatus {
    COMPLETED,
    AWAITING_REVIEW,
    REJECTED,
    FAILED
}
