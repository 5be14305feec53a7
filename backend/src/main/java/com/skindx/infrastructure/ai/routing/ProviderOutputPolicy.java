package com.skindx.infrastructure.ai.routing;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.Classification;
import com.skindx.domain.diagnosis.model.DiseaseCategory;
import com.skindx.infrastructure.ai.provider.ProviderFlags;
import com.skindx.infrastructure.ai.provider.ProviderResponseParser;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a provider answer that reported success is actually usable.
 * A rejected answer is handled by the router like any other failed call.
 */
@Component
public class ProviderOutputPolicy {

    static final String MALFORMED = "malformed response";
    static final String NOT_SKIN = "image is not skin";
    static final String POOR_QUALITY = "insufficient image quality";
    static final String NOT_MEDICAL = "image is not medical";

    /**
     * @return the failure text, or empty when the answer may be used
     */
    public Optional<String> findRejection(AiTask task, Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Optional.of(MALFORMED);
        }
        if (data.size() == 1 && data.containsKey(ProviderResponseParser.RAW_RESPONSE)) {
            return Optional.of(MALFORMED);
        }
        return switch (task) {
            case STAGE0_VALIDATION -> checkGate(data);
            case STAGE1_NORMAL_ABNORMAL -> checkLabel(data.get("classification"));
            case STAGE2_CATEGORY -> checkCategory(data.get("category"));
            case STAGE3_DIAGNOSIS -> checkDisease(data.get("disease"));
            case STAGE4_FUSION -> Optional.empty();
        };
    }

    private Optional<String> checkGate(Map<String, Object> data) {
        if (isFalse(data.get("is_skin"))) return Optional.of(NOT_SKIN);
        if (isFalse(data.get("is_usable"))) return Optional.of(POOR_QUALITY);
        if (isFalse(data.get("is_medical"))) return Optional.of(NOT_MEDICAL);
        return Optional.empty();
    }

    private Optional<String> checkLabel(Object label) {
        if (label == null) return Optional.empty();
        return Classification.fromLabel(label.toString()).isPresent()
                ? Optional.empty()
                : Optional.of("unknown classification '" + label + "'");
    }

    private Optional<String> checkCategory(Object category) {
        if (category == null) return Optional.empty();
        return DiseaseCategory.fromId(category.toString()).isPresent()
                ? Optional.empty()
                : Optional.of("unknown category '" + category + "'");
    }

    private Optional<String> checkDisease(Object disease) {
        if (disease == null || disease.toString().isBlank()) {
            return Optional.of("no disease in response");
        }
        return Optional.empty();
    }

    private static boolean isFalse(Object value) {
        return ProviderFlags.read(value).map(flag -> !flag).orElse(false);
    }
}
