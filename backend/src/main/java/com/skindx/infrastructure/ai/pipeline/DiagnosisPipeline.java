package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.PipelineStage;
import com.skindx.domain.diagnosis.model.SkippedStage;
import com.skindx.domain.diagnosis.model.StageResult;
import com.skindx.domain.diagnosis.model.PipelineResult;
import com.skindx.domain.diagnosis.service.RecordSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Orchestrates the diagnosis pipeline for one image:
 * <p>
 * gate → normal/abnormal → (category → diagnosis, abnormal only) → fusion → done
 * </p>
 * The gate is terminal: a rejected image never reaches stage 1. Stages 1-4 always
 * produce a result, falling back to safe defaults when providers fail. Only an
 * unexpected exception fails the run, and stage results produced before it are kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiagnosisPipeline {

    private final Stage0Gate stage0Gate;
    private final Stage1Classifier stage1Classifier;
    private final Stage2CategoryClassifier stage2Classifier;
    private final Stage3Diagnoser stage3Diagnoser;
    private final Stage4Fusion stage4Fusion;
    private final RecordSink recordSink;

    public PipelineResult execute(String diagnosisId, String imagePath, byte[] imageBytes,
                                  Map<String, Object> patientData) {
        DiagnosisPipelineContext ctx = new DiagnosisPipelineContext();
        ctx.setDiagnosisId(diagnosisId);
        ctx.setImagePath(imagePath);
        ctx.setImageBytes(imageBytes);
        ctx.setPatientData(patientData != null ? patientData : Map.of());
        ctx.setStartedAtMs(System.currentTimeMillis());

        try {
            runStages(ctx);
        } catch (RuntimeException e) {
            log.error("[Pipeline] [{}] Pipeline error", diagnosisId, e);
            ctx.setSuccess(false);
            ctx.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        ctx.setTotalDurationMs(System.currentTimeMillis() - ctx.getStartedAtMs());
        return ctx.toPipelineResult();
    }

    private void runStages(DiagnosisPipelineContext ctx) {
        String id = ctx.getDiagnosisId();

        // 0. Validation gate
        log.info("[Pipeline] [{}] Stage 0: validation gate", id);
        ctx.setStage0(stage0Gate.validate(id, ctx.getImagePath(), ctx.getImageBytes()));
        record(id, PipelineStage.STAGE0, ctx.getStage0());

        if (!ctx.getStage0().valid()) {
            ctx.setError(ctx.getStage0().rejectionReason().code());
            log.warn("[Pipeline] [{}] Stage 0 rejected: {}", id, ctx.getError());
            return;
        }

        // 1. Normal vs abnormal
        log.info("[Pipeline] [{}] Stage 1: normal/abnormal classification", id);
        ctx.setStage1(stage1Classifier.classify(id, ctx.getImagePath(), ctx.getImageBytes()));
        record(id, PipelineStage.STAGE1, ctx.getStage1());

        if (ctx.getStage1().isNormal()) {
            log.info("[Pipeline] [{}] Classified as normal, skipping to fusion", id);
            String timestamp = ctx.getStage1().timestamp();
            ctx.setStage2(new SkippedStage(SkippedStage.NORMAL_CLASSIFICATION, timestamp));
            ctx.setStage3(new SkippedStage(SkippedStage.NORMAL_CLASSIFICATION, timestamp));
            record(id, PipelineStage.STAGE2, ctx.getStage2());
            record(id, PipelineStage.STAGE3, ctx.getStage3());
        } else {
            // 2. Category
            log.info("[Pipeline] [{}] Stage 2: category classification", id);
            ctx.setStage2(stage2Classifier.classify(id, ctx.getImagePath(), ctx.getImageBytes(), ctx.getStage1()));
            record(id, PipelineStage.STAGE2, ctx.getStage2());

            // 3. Diagnosis
            log.info("[Pipeline] [{}] Stage 3: disease diagnosis", id);
            ctx.setStage3(stage3Diagnoser.diagnose(id, ctx.getImagePath(), ctx.getImageBytes(),
                    ctx.getStage1(), ctx.categoryResult()));
            record(id, PipelineStage.STAGE3, ctx.getStage3());
        }

        // 4. Fusion
        log.info("[Pipeline] [{}] Stage 4: fusion", id);
        ctx.setStage4(stage4Fusion.fuse(id, ctx.getPatientData(), ctx.getStage1(),
                ctx.categoryResult(), ctx.diagnosisResult()));
        record(id, PipelineStage.STAGE4, ctx.getStage4());

        ctx.setSuccess(true);
        log.info("[Pipeline] [{}] Pipeline completed successfully", id);
    }

    private void record(String diagnosisId, PipelineStage stage, StageResult result) {
        try {
            recordSink.recordStage(diagnosisId, stage, result);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] [{}] Failed to record {}: {}", diagnosisId, stage.recordName(), e.getMessage());
        }
    }
}
