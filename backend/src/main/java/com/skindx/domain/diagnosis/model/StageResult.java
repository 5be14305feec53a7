package com.skindx.domain.diagnosis.model;

/**
 * Metadata every stage snapshot carries, whatever its payload.
 */
public interface StageResult {

    /** Provider name, or a marker such as {@code fallback_default} / {@code validation_failed}. */
    String source();

    boolean fallbackUsed();

    long executionTimeMs();

    /** ISO-8601 instant the stage finished. */
    String timestamp();
}
