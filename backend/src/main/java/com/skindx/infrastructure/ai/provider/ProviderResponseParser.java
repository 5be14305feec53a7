package com.skindx.infrastructure.ai.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a model's text answer into a task output map.
 * <p>
 * Models often wrap JSON in markdown fences or add trailing commas and comments, so
 * fences are stripped and parsing uses a lenient {@link ObjectMapper}. Text that still
 * cannot be read as a JSON object comes back as {@code {"raw_response": text}}.
 */
@Slf4j
@Component
public class ProviderResponseParser {

    public static final String RAW_RESPONSE = "raw_response";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public Map<String, Object> parse(String response) {
        if (response == null || response.isBlank()) {
            return rawResponse("");
        }
        String text = stripFences(response.trim());
        try {
            Map<String, Object> parsed = LENIENT_MAPPER.readValue(text, MAP_TYPE);
            return parsed != null ? parsed : rawResponse(response);
        } catch (JsonProcessingException e) {
            log.warn("[ProviderResponse] Could not parse response as JSON: {}", abbreviate(response));
            return rawResponse(response);
        }
    }

    static String stripFences(String text) {
        if (text.contains("```json")) {
            return between(text, text.indexOf("```json") + 7);
        }
        if (text.contains("```")) {
            return between(text, text.indexOf("```") + 3);
        }
        return text;
    }

    private static String between(String text, int start) {
        int end = text.indexOf("```", start);
        return (end >= 0 ? text.substring(start, end) : text.substring(start)).trim();
    }

    private static Map<String, Object> rawResponse(String response) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(RAW_RESPONSE, response);
        return raw;
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
