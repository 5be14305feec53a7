package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.Classification;
import com.skindx.domain.diagnosis.model.ClassificationResult;
import com.skindx.infrastructure.ai.routing.AiResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.skindx.infrastructure.ai.TaskInputKeys.CLASSES;

/**
 * Normal vs abnormal. Ambiguity resolves to abnormal so the image gets a full analysis.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Stage1Classifier {

    static final String FALLBACK_SOURCE = "fallback_default";
    static final String FALLBACK_NOTE = "Defaulted to abnormal due to AI failure";

    private final StageDispatcher dispatcher;

    public ClassificationResult classify(String diagnosisId, String imagePath, byte[] imageBytes) {
        long start = System.currentTimeMillis();
        Map<String, Object> input = dispatcher.imageInput(diagnosisId, imagePath, imageBytes);
        input.put(CLASSES, List.of(Classification.NORMAL.label(), Classification.ABNORMAL.label()));

        AiResult result = dispatcher.dispatch(AiTask.STAGE1_NORMAL_ABNORMAL, input, diagnosisId);
        long durationMs = System.currentTimeMillis() - start;

        if (result.success() && result.data() != null) {
            ProviderPayload payload = ProviderPayload.of(result.data());
            Classification classification = Classification.fromLabel(payload.text("classification", null))
                    .orElse(Classification.ABNORMAL);
            return new ClassificationResult(
                    classification,
                    payload.number("confidence", 0.85),
                    null,
                    result.provider(),
                    result.fallbackUsed(),
                    durationMs,
                    dispatcher.timestamp());
        }

        log.warn("[Stage1] [{}] Stage 1 failed, defaulting to abnormal", diagnosisId);
        return new ClassificationResult(Classification.ABNORMAL, 0.5, FALLBACK_NOTE,
                FALLBACK_SOURCE, true, durationMs, dispatcher.timestamp());
    }
}
