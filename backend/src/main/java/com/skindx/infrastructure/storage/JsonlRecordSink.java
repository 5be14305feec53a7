package com.skindx.infrastructure.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.PipelineStage;
import com.skindx.domain.diagnosis.model.StageResult;
import com.skindx.domain.diagnosis.service.RecordSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Appends pipeline snapshots and AI-call events as JSON lines:
 * <ul>
 *   <li>{@code <dir>/diagnoses/<id>/pipeline.jsonl}, one line per stage result</li>
 *   <li>{@code <dir>/ai/<yyyy-MM-dd>/events.jsonl}, one line per provider call</li>
 * </ul>
 * Writing is best effort: I/O problems are logged and dropped.
 */
@Slf4j
@Component
public class JsonlRecordSink implements RecordSink {

    static final String PIPELINE_FILE = "pipeline.jsonl";
    static final String EVENTS_FILE = "events.jsonl";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final ObjectMapper jsonMapper;
    private final Path rootDir;
    private final Clock clock;

    @Autowired
    public JsonlRecordSink(ObjectMapper objectMapper,
                           @Value("${skindx.records.dir:data/records}") String rootDir) {
        this(objectMapper, Path.of(rootDir), Clock.systemUTC());
    }

    JsonlRecordSink(ObjectMapper objectMapper, Path rootDir, Clock clock) {
        this.jsonMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.rootDir = rootDir;
        this.clock = clock;
    }

    @Override
    public void recordStage(String diagnosisId, PipelineStage stage, StageResult result) {
        if (!isSafeId(diagnosisId)) {
            log.warn("[Records] Refusing to record {} for unsafe diagnosis id '{}'", stage.recordName(), diagnosisId);
            return;
        }
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", Instant.now(clock).toString());
        line.put("diagnosis_id", diagnosisId);
        line.put("stage", stage.recordName());
        line.put("result", result);
        append(rootDir.resolve("diagnoses").resolve(diagnosisId).resolve(PIPELINE_FILE), line);
    }

    @Override
    public void recordAiCall(String diagnosisId, AiTask task, String provider,
                             boolean success, long durationMs, String error) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", Instant.now(clock).toString());
        line.put("event", "pipeline_stage");
        line.put("diagnosis_id", diagnosisId);
        line.put("stage", task.configKey());
        line.put("provider", provider);
        line.put("success", success);
        line.put("duration_ms", durationMs);
        line.put("error", error);
        append(rootDir.resolve("ai").resolve(LocalDate.now(clock).toString()).resolve(EVENTS_FILE), line);
    }

    private synchronized void append(Path file, Map<String, Object> line) {
        try {
            String json = jsonMapper.writeValueAsString(line);
            Files.createDirectories(file.getParent());
            Files.writeString(file, json + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            log.warn("[Records] Cannot serialize record for {}: {}", file, e.getMessage());
        } catch (IOException e) {
            log.warn("[Records] Cannot write {}: {}", file, e.getMessage());
        }
    }

    private static boolean isSafeId(String diagnosisId) {
        return diagnosisId != null && SAFE_ID.matcher(diagnosisId).matches() && !diagnosisId.startsWith("..");
    }
}
