package com.skindx.infrastructure.ai.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skindx.domain.diagnosis.model.*;
import com.skindx.domain.diagnosis.service.RecordSink;
import com.skindx.infrastructure.ai.provider.AiProviderFactory;
import com.skindx.infrastructure.ai.provider.ProviderKind;
import com.skindx.infrastructure.ai.provider.ProviderResponse;
import com.skindx.infrastructure.ai.provider.StubProvider;
import com.skindx.infrastructure.ai.routing.AiRouter;
import com.skindx.infrastructure.ai.routing.ProviderCallMetrics;
import com.skindx.infrastructure.ai.routing.ProviderOutputPolicy;
import com.skindx.infrastructure.ai.routing.ProviderRegistry;
import com.skindx.infrastructure.ai.routing.RoutingConfig;
import com.skindx.infrastructure.ai.routing.RoutingConfigLoader;
import com.skindx.infrastructure.reference.DiseaseReferenceTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiagnosisPipelineTest {

    private static final byte[] IMAGE = {1, 2, 3};

    @Mock
    private RecordSink recordSink;

    @Nested
    @DisplayName("orchestration")
    class Orchestration {

        @Mock
        private Stage0Gate stage0Gate;
        @Mock
        private Stage1Classifier stage1Classifier;
        @Mock
        private Stage2CategoryClassifier stage2Classifier;
        @Mock
        private Stage3Diagnoser stage3Diagnoser;
        @Mock
        private Stage4Fusion stage4Fusion;

        private DiagnosisPipeline pipeline;

        @BeforeEach
        void setUp() {
            pipeline = new DiagnosisPipeline(stage0Gate, stage1Classifier, stage2Classifier,
                    stage3Diagnoser, stage4Fusion, recordSink);
        }

        @Test
        @DisplayName("a rejected image stops the pipeline before stage 1")
        void gate_rejection_is_terminal() {
            when(stage0Gate.validate("d1", null, IMAGE))
                    .thenReturn(GateResult.rejected(RejectionReason.NOT_SKIN_IMAGE, 5, StageFixtures.TS));

            PipelineResult result = pipeline.execute("d1", null, IMAGE, Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.rejectedByGate()).isTrue();
            assertThat(result.error()).isEqualTo("not_skin_image");
            assertThat(result.stage1()).isNull();
            assertThat(result.stage4()).isNull();
            verify(stage1Classifier, never()).classify(anyString(), any(), any());
            verify(recordSink).recordStage(eq("d1"), eq(PipelineStage.STAGE0), any());
            verify(recordSink, never()).recordStage(eq("d1"), eq(PipelineStage.STAGE1), any());
        }

        @Test
        @DisplayName("normal skin skips stages 2 and 3 with markers")
        void normal_skips_category_and_diagnosis() {
            when(stage0Gate.validate("d1", null, IMAGE)).thenReturn(StageFixtures.acceptedGate());
            when(stage1Classifier.classify("d1", null, IMAGE)).thenReturn(StageFixtures.normal());
            FusionResult healthy = new FusionResult("normal_skin", 0.9, "none", "none", null, List.of(),
                    "none", List.of("stage1"), "normal_shortcut", false, 0, StageFixtures.TS);
            when(stage4Fusion.fuse(eq("d1"), any(), eq(StageFixtures.normal()), eq(null), eq(null)))
                    .thenReturn(healthy);

            PipelineResult result = pipeline.execute("d1", null, IMAGE, null);

            assertThat(result.success()).isTrue();
            assertThat(result.stage2()).isInstanceOf(SkippedStage.class);
            assertThat(result.stage3()).isInstanceOf(SkippedStage.class);
            assertThat(((SkippedStage) result.stage2()).reason()).isEqualTo("normal_classification");
            assertThat(result.stage4()).isSameAs(healthy);
            verify(stage2Classifier, never()).classify(anyString(), any(), any(), any());
            verify(stage3Diagnoser, never()).diagnose(anyString(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("abnormal skin runs every stage and records each one")
        void abnormal_runs_all_stages() {
            ClassificationResult stage1 = StageFixtures.abnormal(0.9);
            CategoryResult stage2 = StageFixtures.category(DiseaseCategory.INFECTIOUS, 0.8);
            DiseaseDiagnosisResult stage3 = StageFixtures.diagnosis("scabies", 0.7);
            FusionResult stage4 = new FusionResult("scabies", 0.79, "moderate", "routine", null, List.of(),
                    "consult_doctor", List.of(), "openrouter", false, 10, StageFixtures.TS);
            when(stage0Gate.validate("d1", null, IMAGE)).thenReturn(StageFixtures.acceptedGate());
            when(stage1Classifier.classify("d1", null, IMAGE)).thenReturn(stage1);
            when(stage2Classifier.classify("d1", null, IMAGE, stage1)).thenReturn(stage2);
            when(stage3Diagnoser.diagnose("d1", null, IMAGE, stage1, stage2)).thenReturn(stage3);
            when(stage4Fusion.fuse("d1", Map.of("age", 40), stage1, stage2, stage3)).thenReturn(stage4);

            PipelineResult result = pipeline.execute("d1", null, IMAGE, Map.of("age", 40));

            assertThat(result.success()).isTrue();
            assertThat(result.error()).isNull();
            assertThat(result.stage3()).isSameAs(stage3);
            assertThat(result.stage4()).isSameAs(stage4);
            assertThat(result.totalDurationMs()).isGreaterThanOrEqualTo(0);
            for (PipelineStage stage : PipelineStage.values()) {
                verify(recordSink).recordStage(eq("d1"), eq(stage), any());
            }
        }

        @Test
        @DisplayName("an unexpected exception fails the run and keeps earlier stages")
        void fatal_error_keeps_partial_results() {
            ClassificationResult stage1 = StageFixtures.abnormal(0.9);
            CategoryResult stage2 = StageFixtures.category(DiseaseCategory.INFECTIOUS, 0.8);
            when(stage0Gate.validate("d1", null, IMAGE)).thenReturn(StageFixtures.acceptedGate());
            when(stage1Classifier.classify("d1", null, IMAGE)).thenReturn(stage1);
            when(stage2Classifier.classify("d1", null, IMAGE, stage1)).thenReturn(stage2);
            when(stage3Diagnoser.diagnose("d1", null, IMAGE, stage1, stage2))
                    .thenThrow(new IllegalStateException("disease table unavailable"));

            PipelineResult result = pipeline.execute("d1", null, IMAGE, Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("disease table unavailable");
            assertThat(result.stage1()).isSameAs(stage1);
            assertThat(result.stage2()).isSameAs(stage2);
            assertThat(result.stage3()).isNull();
            verify(stage4Fusion, never()).fuse(anyString(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("a failing record sink does not change the outcome")
        void record_sink_failure_ignored() {
            when(stage0Gate.validate("d1", null, IMAGE))
                    .thenReturn(GateResult.rejected(RejectionReason.VALIDATION_FAILED, 5, StageFixtures.TS));
            doThrow(new IllegalStateException("disk full"))
                    .when(recordSink).recordStage(eq("d1"), eq(PipelineStage.STAGE0), any());

            PipelineResult result = pipeline.execute("d1", null, IMAGE, Map.of());

            assertThat(result.error()).isEqualTo("validation_failed");
            assertThat(result.stage0().valid()).isFalse();
        }
    }

    @Nested
    @DisplayName("end to end with stub providers")
    class EndToEnd {

        private ExecutorService executor;

        @BeforeEach
        void setUp() {
            executor = Executors.newCachedThreadPool();
        }

        @AfterEach
        void tearDown() {
            executor.shutdownNow();
        }

        private DiagnosisPipeline pipeline(StubProvider... providers) {
            ObjectMapper objectMapper = new ObjectMapper();
            RoutingConfig config = new RoutingConfigLoader(objectMapper,
                    new ClassPathResource("config/ai_routing.json")).load();
            List<AiProviderFactory> factories = Arrays.stream(providers)
                    .map(p -> AiProviderFactory.of(p.kind(), () -> p))
                    .toList();
            AiRouter router = new AiRouter(config, new ProviderRegistry(factories), new ProviderOutputPolicy(),
                    recordSink, new ProviderCallMetrics(), executor);
            StageDispatcher dispatcher = new StageDispatcher(router);
            StagePayloadMapper payloadMapper = new StagePayloadMapper(objectMapper);
            DiseaseReferenceTable diseases = new DiseaseReferenceTable(objectMapper, new ClassPathResource("diseases.json"));
            return new DiagnosisPipeline(
                    new Stage0Gate(dispatcher),
                    new Stage1Classifier(dispatcher),
                    new Stage2CategoryClassifier(dispatcher, payloadMapper),
                    new Stage3Diagnoser(dispatcher, payloadMapper, diseases),
                    new Stage4Fusion(dispatcher, payloadMapper),
                    recordSink);
        }

        @Test
        @DisplayName("every gate provider reporting non-skin rejects the image")
        void non_skin_everywhere() {
            Map<String, Object> notSkin = Map.of("is_skin", false, "is_medical", false, "is_usable", true);
            StubProvider internal = StubProvider.answering(ProviderKind.INTERNAL, notSkin);
            StubProvider gemini = StubProvider.answering(ProviderKind.GEMINI, notSkin);

            PipelineResult result = pipeline(internal, gemini).execute("d1", null, IMAGE, Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isNotBlank();
            assertThat(result.stage0().rejectionReason()).isEqualTo(RejectionReason.NOT_SKIN_IMAGE);
            assertThat(internal.calls()).isEqualTo(1);
            assertThat(gemini.calls()).isEqualTo(1);
            assertThat(result.stage1()).isNull();
            verify(recordSink, never()).recordStage(eq("d1"), eq(PipelineStage.STAGE1), any());
        }

        @Test
        @DisplayName("a quoted \"no\" for is_skin is a rejection, not an accepted non-skin image")
        void string_no_rejects() {
            Map<String, Object> answer = Map.of("is_skin", "no", "is_medical", "yes", "is_usable", "yes");
            StubProvider internal = StubProvider.answering(ProviderKind.INTERNAL, answer);
            StubProvider gemini = StubProvider.answering(ProviderKind.GEMINI, answer);

            PipelineResult result = pipeline(internal, gemini).execute("d1", null, IMAGE, Map.of());

            assertThat(result.stage0().valid()).isFalse();
            assertThat(result.stage0().rejectionReason()).isEqualTo(RejectionReason.NOT_SKIN_IMAGE);
        }

        @Test
        @DisplayName("external providers down: internal model carries the run with fallbacks")
        void internal_only() {
            StubProvider internal = StubProvider.of(ProviderKind.INTERNAL, task -> switch (task) {
                case STAGE0_VALIDATION -> ProviderResponse.ok(
                        Map.of("is_skin", true, "is_medical", true, "is_usable", true, "confidence", 0.75));
                case STAGE1_NORMAL_ABNORMAL -> ProviderResponse.ok(
                        Map.of("classification", "abnormal", "confidence", 0.65));
                case STAGE2_CATEGORY -> ProviderResponse.ok(
                        Map.of("category", "inflammatory", "subcategory", "dermatitis", "confidence", 0.5));
                default -> ProviderResponse.failure("unsupported");
            });

            PipelineResult result = pipeline(internal).execute("d2", null, IMAGE, Map.of());

            assertThat(result.success()).isTrue();
            assertThat(result.stage0().source()).isEqualTo("internal");
            assertThat(((CategoryResult) result.stage2()).category()).isEqualTo(DiseaseCategory.INFLAMMATORY);
            DiseaseDiagnosisResult stage3 = (DiseaseDiagnosisResult) result.stage3();
            assertThat(stage3.disease()).isEqualTo("unknown");
            assertThat(stage3.requiresDoctorReview()).isTrue();
            assertThat(result.stage4().source()).isEqualTo("fallback_fusion");
            assertThat(result.stage4().finalConfidence()).isCloseTo(0.24, within(1e-9));
        }

        @Test
        @DisplayName("normal skin never asks a provider for fusion")
        void normal_skin() {
            StubProvider internal = StubProvider.of(ProviderKind.INTERNAL, task -> switch (task) {
                case STAGE0_VALIDATION -> ProviderResponse.ok(
                        Map.of("is_skin", true, "is_medical", true, "is_usable", true));
                default -> ProviderResponse.ok(
                        Map.of("classification", "normal", "confidence", 0.65));
            });
            StubProvider openrouter = StubProvider.failing(ProviderKind.OPENROUTER, "should not be called for fusion");

            PipelineResult result = pipeline(internal, openrouter).execute("d3", null, IMAGE, Map.of());

            assertThat(result.success()).isTrue();
            assertThat(result.stage2()).isInstanceOf(SkippedStage.class);
            assertThat(result.stage4().finalDiagnosis()).isEqualTo("normal_skin");
            assertThat(openrouter.lastInput(AiTask.STAGE4_FUSION)).isNull();
        }
    }
}
