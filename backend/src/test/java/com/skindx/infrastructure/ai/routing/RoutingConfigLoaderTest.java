package com.skindx.infrastructure.ai.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skindx.domain.diagnosis.model.AiTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.lang.reflect.RecordComponent;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingConfigLoaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("shipped routing table keeps primary then fallback order")
    void shipped_table() {
        RoutingConfig config = new RoutingConfigLoader(objectMapper, new ClassPathResource("config/ai_routing.json")).load();

        assertThat(config.candidateChain(AiTask.STAGE0_VALIDATION)).containsExactly("internal", "gemini");
        assertThat(config.candidateChain(AiTask.STAGE1_NORMAL_ABNORMAL))
                .containsExactly("internal", "openrouter", "gemini", "groq");
        assertThat(config.candidateChain(AiTask.STAGE2_CATEGORY))
                .containsExactly("openrouter", "gemini", "groq", "internal");
        assertThat(config.candidateChain(AiTask.STAGE4_FUSION)).containsExactly("openrouter", "groq");
        assertThat(config.timeoutMsFor("groq")).isEqualTo(15_000L);
        assertThat(config.fallbackBehavior().effectiveRetryDelayMs()).isEqualTo(500L);
        assertThat(config.fallbackBehavior().effectiveMaxRetries()).isEqualTo(3);
    }

    @Test
    @DisplayName("missing file yields defaults routing everything to the internal model")
    void missing_file_defaults() {
        RoutingConfig config = new RoutingConfigLoader(objectMapper,
                new FileSystemResource(tempDir.resolve("absent.json"))).load();

        assertThat(config.candidateChain(AiTask.STAGE3_DIAGNOSIS)).containsExactly("internal");
        assertThat(config.providers()).containsKeys("internal", "openrouter", "gemini", "groq");
        assertThat(config.isEnabled("groq")).isTrue();
    }

    @Test
    @DisplayName("missing primary list defaults to internal and unknown keys are ignored")
    void partial_route() throws IOException {
        Path file = tempDir.resolve("routing.json");
        Files.writeString(file, """
                {
                  "version": 2,
                  "providers": {"groq": {"enabled": false, "description": "off"}},
                  "stage_routing": {"stage4_fusion": {"fallback": ["groq"]}}
                }
                """);

        RoutingConfig config = new RoutingConfigLoader(objectMapper, new FileSystemResource(file)).load();

        assertThat(config.candidateChain(AiTask.STAGE4_FUSION)).containsExactly("internal", "groq");
        assertThat(config.isEnabled("groq")).isFalse();
        assertThat(config.isEnabled("openrouter")).isTrue();
        assertThat(config.fallbackBehavior().effectiveExponentialBackoff()).isTrue();
    }

    @Test
    @DisplayName("provider entries carry routing settings only; a model key is ignored")
    void provider_model_key_ignored() throws IOException {
        Path file = tempDir.resolve("routing.json");
        Files.writeString(file, """
                {
                  "providers": {"gemini": {"enabled": true, "priority": 2, "timeout_ms": 9000,
                                           "model": "gemini-1.5-pro"}},
                  "stage_routing": {"stage2_category": {"primary": ["gemini"]}}
                }
                """);

        RoutingConfig config = new RoutingConfigLoader(objectMapper, new FileSystemResource(file)).load();

        assertThat(config.candidateChain(AiTask.STAGE2_CATEGORY)).containsExactly("gemini");
        assertThat(config.timeoutMsFor("gemini")).isEqualTo(9_000L);
        assertThat(RoutingConfig.ProviderSettings.class.getRecordComponents())
                .extracting(RecordComponent::getName)
                .containsExactly("enabled", "priority", "timeoutMs");
    }

    @Test
    @DisplayName("malformed file is reported, not silently replaced")
    void malformed_file() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"providers\": ");

        RoutingConfigLoader loader = new RoutingConfigLoader(objectMapper, new FileSystemResource(file));

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid routing config");
    }
}
