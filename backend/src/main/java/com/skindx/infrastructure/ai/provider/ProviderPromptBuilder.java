package com.skindx.infrastructure.ai.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skindx.domain.diagnosis.model.AiTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.skindx.infrastructure.ai.TaskInputKeys.*;

/**
 * Task prompts shared by the chat-completion providers. Every prompt ends with the
 * JSON shape the stage modules read back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderPromptBuilder {

    private final ObjectMapper objectMapper;

    public String build(AiTask task, Map<String, Object> input) {
        return switch (task) {
            case STAGE0_VALIDATION -> """
                    Analyze this image and determine:
                    1. Is this an image of human skin?
                    2. Does it show a potential skin condition or disease?
                    3. Is the image quality sufficient for medical analysis?

                    Respond ONLY with JSON:
                    {"is_skin": true/false, "is_medical": true/false, "is_usable": true/false, "confidence": 0.0-1.0, "reason": "explanation"}""";
            case STAGE1_NORMAL_ABNORMAL -> """
                    Examine this skin image and classify:
                    - Normal: Healthy skin with no visible abnormalities
                    - Abnormal: Shows signs of disease, lesion, discoloration, or inflammation
                    Consider: color uniformity, texture, visible lesions, inflammation.

                    Respond ONLY with JSON: {"classification": "normal" or "abnormal", "confidence": 0.0-1.0, "observations": "what you see"}""";
            case STAGE2_CATEGORY -> """
                    Classify this skin condition into one of these categories:
                    %s

                    Consider: lesion type, color, pattern, distribution.
                    Previous analysis: %s

                    Respond ONLY with JSON: {"category": "category_id", "subcategory": "subcategory_id or null", "confidence": 0.0-1.0}"""
                    .formatted(render(input.get(CATEGORIES)), render(input.get(STAGE1_RESULT)));
            case STAGE3_DIAGNOSIS -> """
                    You are a dermatology AI. Identify the most likely condition.
                    Category: %s
                    Subcategory: %s
                    Possible conditions: %s
                    Previous analysis: %s

                    Respond ONLY with JSON: {"disease": "disease_id", "confidence": 0.0-1.0, "severity": "mild/moderate/severe", "differential": ["other disease ids"]}"""
                    .formatted(input.get(CATEGORY), input.get(SUBCATEGORY),
                            render(diseaseIds(input.get(POSSIBLE_DISEASES))), render(input.get(STAGE2_RESULT)));
            case STAGE4_FUSION -> """
                    Generate the final diagnosis report.
                    Stage 1: %s
                    Stage 2: %s
                    Stage 3: %s
                    Patient data: %s

                    Respond ONLY with JSON: {"diagnosis": "disease_id", "confidence": 0.0-1.0, "severity": "mild/moderate/severe", "urgency": "routine/urgent/emergency", "explanation": "text", "recommendations": ["list"], "follow_up": "text"}"""
                    .formatted(render(input.get(STAGE1)), render(input.get(STAGE2)),
                            render(input.get(STAGE3)), render(input.get(PATIENT_DATA)));
        };
    }

    private static List<Object> diseaseIds(Object possibleDiseases) {
        if (!(possibleDiseases instanceof List<?> list)) return List.of();
        return list.stream()
                .map(d -> d instanceof Map<?, ?> m ? m.get("id") : d)
                .filter(Objects::nonNull)
                .map(Object.class::cast)
                .toList();
    }

    private String render(Object value) {
        if (value == null) return "{}";
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[Prompt] Falling back to toString for {}", value.getClass().getSimpleName());
            return value.toString();
        }
    }
}
