package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.CategoryResult;
import com.skindx.domain.diagnosis.model.ClassificationResult;
import com.skindx.domain.diagnosis.model.Confidence;
import com.skindx.domain.diagnosis.model.DiseaseDiagnosisResult;
import com.skindx.domain.diagnosis.model.FusionResult;
import com.skindx.domain.diagnosis.model.LocalizedText;
import com.skindx.infrastructure.ai.routing.AiResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.skindx.infrastructure.ai.TaskInputKeys.*;

/**
 * Combines stage outputs and patient data into the final verdict.
 * <p>
 * Normal skin never reaches a provider. For abnormal skin the final confidence is a
 * weighted blend: stage1 0.1, stage2 0.2, stage3 0.4, fusion 0.3, capped at 0.99.
 * When every fusion provider fails, the stage 3 diagnosis is reused at 80% confidence
 * and the patient is told to see a doctor.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Stage4Fusion {

    static final String NORMAL_SHORTCUT_SOURCE = "normal_shortcut";
    static final String FALLBACK_SOURCE = "fallback_fusion";
    static final double MAX_CONFIDENCE = 0.99;
    static final double DEFAULT_FUSION_CONFIDENCE = 0.7;
    static final double FALLBACK_CONFIDENCE_FACTOR = 0.8;

    private static final LocalizedText HEALTHY_EXPLANATION = new LocalizedText(
            "The skin appears healthy with no visible abnormalities.",
            "يبدو الجلد صحيًا بدون أي تشوهات مرئية.");
    private static final List<LocalizedText> HEALTHY_RECOMMENDATIONS = List.of(
            new LocalizedText("Continue regular skincare routine", "استمر في روتين العناية بالبشرة"),
            new LocalizedText("Use sunscreen daily", "استخدم واقي الشمس يوميًا"),
            new LocalizedText("Monitor for any changes", "راقب أي تغييرات"));

    private static final LocalizedText FALLBACK_EXPLANATION = new LocalizedText(
            "AI analysis indicates a potential skin condition. Please consult a dermatologist.",
            "يشير تحليل الذكاء الاصطناعي إلى حالة جلدية محتملة. يرجى استشارة طبيب جلدية.");
    private static final List<LocalizedText> FALLBACK_RECOMMENDATIONS = List.of(
            new LocalizedText("Consult a dermatologist", "استشر طبيب جلدية"),
            new LocalizedText("Keep the area clean and dry", "حافظ على المنطقة نظيفة وجافة"),
            new LocalizedText("Avoid scratching", "تجنب الحك"));

    private final StageDispatcher dispatcher;
    private final StagePayloadMapper payloadMapper;

    /**
     * @param stage2 null when stage 1 found normal skin
     * @param stage3 null when stage 1 found normal skin
     */
    public FusionResult fuse(String diagnosisId, Map<String, Object> patientData,
                             ClassificationResult stage1, CategoryResult stage2, DiseaseDiagnosisResult stage3) {
        long start = System.currentTimeMillis();

        if (stage1.isNormal()) {
            log.info("[Stage4] [{}] Normal skin, skipping provider fusion", diagnosisId);
            return normalResult(System.currentTimeMillis() - start);
        }
        Objects.requireNonNull(stage2, "stage2 is required for abnormal skin");
        Objects.requireNonNull(stage3, "stage3 is required for abnormal skin");

        Map<String, Object> input = new HashMap<>();
        input.put(DIAGNOSIS_ID, diagnosisId);
        input.put(PATIENT_DATA, patientData != null ? patientData : Map.of());
        input.put(STAGE1, payloadMapper.toMap(stage1));
        input.put(STAGE2, payloadMapper.toMap(stage2));
        input.put(STAGE3, payloadMapper.toMap(stage3));

        AiResult result = dispatcher.dispatch(AiTask.STAGE4_FUSION, input, diagnosisId);
        long durationMs = System.currentTimeMillis() - start;

        if (result.success() && result.data() != null) {
            ProviderPayload payload = ProviderPayload.of(result.data());
            double fusionConfidence = Confidence.clamp(payload.number("confidence", DEFAULT_FUSION_CONFIDENCE));
            LocalizedText explanation = LocalizedText.from(payload.raw("explanation"));
            return new FusionResult(
                    payload.text("diagnosis", stage3.disease()),
                    blendConfidence(stage1.confidence(), stage2.confidence(), stage3.confidence(), fusionConfidence),
                    payload.text("severity", stage3.severity() != null ? stage3.severity() : "moderate"),
                    payload.text("urgency", "routine"),
                    explanation != null ? explanation : LocalizedText.english(""),
                    payload.list("recommendations").stream().map(LocalizedText::from).toList(),
                    payload.text("follow_up", "consult_doctor"),
                    List.of(STAGE1, STAGE2, STAGE3, "patient_history"),
                    result.provider(),
                    result.fallbackUsed(),
                    durationMs,
                    dispatcher.timestamp());
        }

        log.warn("[Stage4] [{}] Fusion failed, reusing stage 3 diagnosis", diagnosisId);
        return new FusionResult(
                stage3.disease(),
                stage3.confidence() * FALLBACK_CONFIDENCE_FACTOR,
                stage3.severity() != null ? stage3.severity() : "moderate",
                "consult_doctor",
                FALLBACK_EXPLANATION,
                FALLBACK_RECOMMENDATIONS,
                "1_week",
                List.of(STAGE3),
                FALLBACK_SOURCE,
                true,
                durationMs,
                dispatcher.timestamp());
    }

    /**
     * Inputs are expected in [0, 1]; the result is rounded to two decimals.
     */
    static double blendConfidence(double stage1, double stage2, double stage3, double fusion) {
        double total = 0.1 * stage1 + 0.2 * stage2 + 0.4 * stage3 + 0.3 * fusion;
        return Confidence.round2(Math.min(total, MAX_CONFIDENCE));
    }

    private FusionResult normalResult(long durationMs) {
        return new FusionResult("normal_skin", 0.9, "none", "none",
                HEALTHY_EXPLANATION, HEALTHY_RECOMMENDATIONS, "none", List.of(STAGE1),
                NORMAL_SHORTCUT_SOURCE, false, durationMs, dispatcher.timestamp());
    }
}
