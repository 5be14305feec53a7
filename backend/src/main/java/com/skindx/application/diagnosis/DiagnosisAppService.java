package com.skindx.application.diagnosis;

import com.skindx.application.diagnosis.exception.InvalidDiagnosisRequestException;
import com.skindx.domain.diagnosis.model.CategoryResult;
import com.skindx.domain.diagnosis.model.DiagnosisStatus;
import com.skindx.domain.diagnosis.model.DiseaseDiagnosisResult;
import com.skindx.domain.diagnosis.model.PipelineResult;
import com.skindx.infrastructure.ai.pipeline.DiagnosisPipeline;
import com.skindx.infrastructure.reference.SpecialtyDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosisAppService {

    private final DiagnosisPipeline diagnosisPipeline;
    private final SpecialtyDirectory specialtyDirectory;

    /**
     * Runs the pipeline for one request and decides what happens to the diagnosis next.
     */
    public DiagnosisOutcome process(DiagnosisRequest request) {
        validate(request);
        String id = request.diagnosisId();
        log.info("Starting diagnosis pipeline for {}", id);

        PipelineResult result = diagnosisPipeline.execute(id, request.imagePath(), request.imageBytes(),
                request.patientData());

        if (result.rejectedByGate()) {
            log.warn("Diagnosis {} rejected: {}", id, result.error());
            return new DiagnosisOutcome(id, DiagnosisStatus.REJECTED, result, null);
        }
        if (!result.success()) {
            log.error("Diagnosis {} failed: {}", id, result.error());
            return new DiagnosisOutcome(id, DiagnosisStatus.FAILED, result, null);
        }
        if (request.doctorReviewRequested() || needsReview(result)) {
            String specialty = specialtyDirectory.specialtyFor(
                    result.stage2() instanceof CategoryResult category ? category.category() : null);
            log.info("Diagnosis {} awaiting review by {}", id, specialty);
            return new DiagnosisOutcome(id, DiagnosisStatus.AWAITING_REVIEW, result, specialty);
        }

        log.info("Diagnosis {} completed successfully", id);
        return new DiagnosisOutcome(id, DiagnosisStatus.COMPLETED, result, null);
    }

    private static boolean needsReview(PipelineResult result) {
        return result.stage3() instanceof DiseaseDiagnosisResult diagnosis && diagnosis.requiresDoctorReview();
    }

    private static void validate(DiagnosisRequest request) {
        if (request == null) {
            throw new InvalidDiagnosisRequestException("Diagnosis request is required");
        }
        if (request.diagnosisId() == null || request.diagnosisId().isBlank()) {
            throw new InvalidDiagnosisRequestException("Diagnosis id is required");
        }
        boolean hasBytes = request.imageBytes() != null && request.imageBytes().length > 0;
        boolean hasPath = request.imagePath() != null && !request.imagePath().isBlank();
        if (!hasBytes && !hasPath) {
            throw new InvalidDiagnosisRequestException("An image is required");
        }
    }
}
