package com.skindx.infrastructure.ai.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.skindx.domain.diagnosis.model.StageResult;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns earlier stage results into the snake_case maps later providers receive as context.
 */
@Component
public class StagePayloadMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper snakeCaseMapper;

    public StagePayloadMapper(ObjectMapper objectMapper) {
        this.snakeCaseMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public Map<String, Object> toMap(StageResult result) {
        if (result == null) return Map.of();
        return snakeCaseMapper.convertValue(result, MAP_TYPE);
    }
}
