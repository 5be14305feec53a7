package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.GateResult;
import com.skindx.domain.diagnosis.model.RejectionReason;
import com.skindx.infrastructure.ai.routing.AiResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Mandatory validation gate: is the image skin, medical, and good enough to analyze.
 * <p>
 * There is no default that lets an image through. If no provider accepts it, the
 * image is rejected with guidance for the user.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Stage0Gate {

    private final StageDispatcher dispatcher;

    public GateResult validate(String diagnosisId, String imagePath, byte[] imageBytes) {
        long start = System.currentTimeMillis();
        Map<String, Object> input = dispatcher.imageInput(diagnosisId, imagePath, imageBytes);

        AiResult result = dispatcher.dispatch(AiTask.STAGE0_VALIDATION, input, diagnosisId);
        long durationMs = System.currentTimeMillis() - start;

        if (result.success() && result.data() != null) {
            ProviderPayload payload = ProviderPayload.of(result.data());
            return GateResult.accepted(
                    payload.bool("is_skin", true),
                    payload.bool("is_medical", true),
                    payload.bool("is_usable", true),
                    payload.number("confidence", 0.95),
                    result.provider(),
                    result.fallbackUsed(),
                    durationMs,
                    dispatcher.timestamp());
        }

        RejectionReason reason = rejectionReasonFor(result);
        log.warn("[Gate] [{}] Image rejected: {}", diagnosisId, reason.code());
        return GateResult.rejected(reason, durationMs, dispatcher.timestamp());
    }

    /**
     * Matches the router error and every attempt error; first matching phrase wins.
     */
    static RejectionReason rejectionReasonFor(AiResult result) {
        StringBuilder errors = new StringBuilder();
        if (result.error() != null) {
            errors.append(result.error());
        }
        for (AiResult.ProviderAttempt attempt : result.attempts()) {
            if (attempt.error() != null) {
                errors.append(' ').append(attempt.error());
            }
        }
        String text = errors.toString().toLowerCase(Locale.ROOT);

        if (text.contains("not skin")) return RejectionReason.NOT_SKIN_IMAGE;
        if (text.contains("quality")) return RejectionReason.POOR_IMAGE_QUALITY;
        if (text.contains("not medical")) return RejectionReason.NOT_MEDICAL_IMAGE;
        return RejectionReason.VALIDATION_FAILED;
    }
}
