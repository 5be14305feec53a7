package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.CategoryResult;
import com.skindx.domain.diagnosis.model.ClassificationResult;
import com.skindx.domain.diagnosis.model.DiseaseDiagnosisResult;
import com.skindx.domain.diagnosis.model.DiseaseReference;
import com.skindx.domain.diagnosis.model.LocalizedText;
import com.skindx.infrastructure.ai.routing.AiResult;
import com.skindx.infrastructure.reference.DiseaseReferenceTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.skindx.infrastructure.ai.TaskInputKeys.*;

/**
 * Fine-grained diagnosis within the category chosen by stage 2.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Stage3Diagnoser {

    static final LocalizedText UNKNOWN_CONDITION = new LocalizedText("Unknown Condition", "حالة غير معروفة");

    private final StageDispatcher dispatcher;
    private final StagePayloadMapper payloadMapper;
    private final DiseaseReferenceTable diseaseTable;

    public DiseaseDiagnosisResult diagnose(String diagnosisId, String imagePath, byte[] imageBytes,
                                           ClassificationResult stage1, CategoryResult stage2) {
        long start = System.currentTimeMillis();
        String category = stage2.category().id();
        List<DiseaseReference> candidates = diseaseTable.findByCategory(category);

        Map<String, Object> input = dispatcher.imageInput(diagnosisId, imagePath, imageBytes);
        input.put(CATEGORY, category);
        if (stage2.subcategory() != null) input.put(SUBCATEGORY, stage2.subcategory());
        input.put(POSSIBLE_DISEASES, candidates.stream().map(this::candidate).toList());
        input.put(STAGE1_RESULT, payloadMapper.toMap(stage1));
        input.put(STAGE2_RESULT, payloadMapper.toMap(stage2));

        AiResult result = dispatcher.dispatch(AiTask.STAGE3_DIAGNOSIS, input, diagnosisId);
        long durationMs = System.currentTimeMillis() - start;

        if (result.success() && result.data() != null) {
            ProviderPayload payload = ProviderPayload.of(result.data());
            String diseaseId = payload.text("disease", DiseaseDiagnosisResult.UNKNOWN_DISEASE);
            LocalizedText name = diseaseTable.findById(diseaseId)
                    .map(DiseaseReference::name)
                    .orElse(LocalizedText.english(diseaseId));
            return new DiseaseDiagnosisResult(
                    diseaseId,
                    name,
                    payload.number("confidence", 0.7),
                    payload.text("severity", "moderate"),
                    payload.strings("differential"),
                    false,
                    result.provider(),
                    result.fallbackUsed(),
                    durationMs,
                    dispatcher.timestamp());
        }

        log.warn("[Stage3] [{}] Stage 3 failed, flagging for doctor review", diagnosisId);
        return new DiseaseDiagnosisResult(DiseaseDiagnosisResult.UNKNOWN_DISEASE, UNKNOWN_CONDITION, 0.3,
                "unknown", List.of(), true, Stage1Classifier.FALLBACK_SOURCE, true,
                durationMs, dispatcher.timestamp());
    }

    private Map<String, Object> candidate(DiseaseReference disease) {
        return Map.of(
                "id", disease.id(),
                "name", disease.name() != null && disease.name().en() != null ? disease.name().en() : disease.id(),
                "subcategory", disease.subcategory() != null ? disease.subcategory() : "");
    }
}
