package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.CategoryResult;
import com.skindx.domain.diagnosis.model.ClassificationResult;
import com.skindx.domain.diagnosis.model.DiseaseCategory;
import com.skindx.infrastructure.ai.routing.AiResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.skindx.infrastructure.ai.TaskInputKeys.CATEGORIES;
import static com.skindx.infrastructure.ai.TaskInputKeys.STAGE1_RESULT;

@Slf4j
@Component
@RequiredArgsConstructor
public class Stage2CategoryClassifier {

    private final StageDispatcher dispatcher;
    private final StagePayloadMapper payloadMapper;

    public CategoryResult classify(String diagnosisId, String imagePath, byte[] imageBytes,
                                   ClassificationResult stage1) {
        long start = System.currentTimeMillis();
        Map<String, Object> input = dispatcher.imageInput(diagnosisId, imagePath, imageBytes);
        input.put(STAGE1_RESULT, payloadMapper.toMap(stage1));
        input.put(CATEGORIES, DiseaseCategory.ids());

        AiResult result = dispatcher.dispatch(AiTask.STAGE2_CATEGORY, input, diagnosisId);
        long durationMs = System.currentTimeMillis() - start;

        if (result.success() && result.data() != null) {
            ProviderPayload payload = ProviderPayload.of(result.data());
            DiseaseCategory category = DiseaseCategory.fromId(payload.text("category", null))
                    .orElse(DiseaseCategory.INFLAMMATORY);
            return new CategoryResult(
                    category,
                    subcategory(payload),
                    payload.number("confidence", 0.75),
                    result.provider(),
                    result.fallbackUsed(),
                    durationMs,
                    dispatcher.timestamp());
        }

        log.warn("[Stage2] [{}] Stage 2 failed, using fallback", diagnosisId);
        return new CategoryResult(DiseaseCategory.INFLAMMATORY, null, 0.4,
                Stage1Classifier.FALLBACK_SOURCE, true, durationMs, dispatcher.timestamp());
    }

    // providers sometimes answer the literal string "null"
    private static String subcategory(ProviderPayload payload) {
        String subcategory = payload.text("subcategory", null);
        return subcategory == null || "null".equalsIgnoreCase(subcategory) ? null : subcategory;
    }
}
