package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.model.Classification;
import com.skindx.domain.diagnosis.model.ClassificationResult;
import com.skindx.infrastructure.ai.routing.AiResult;
import com.skindx.infrastructure.ai.routing.AiRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Stage1ClassifierTest {

    @Mock
    private AiRouter router;

    private Stage1Classifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new Stage1Classifier(new StageDispatcher(router));
    }

    @Test
    @DisplayName("provider label and confidence are used as returned")
    void provider_answer() {
        when(router.route(eq(AiTask.STAGE1_NORMAL_ABNORMAL),
                argThat(input -> List.of("normal", "abnormal").equals(input.get("classes"))), eq("d1")))
                .thenReturn(AiResult.succeeded("internal",
                        Map.of("classification", "normal", "confidence", 0.65), 3, false, List.of()));

        ClassificationResult result = classifier.classify("d1", null, new byte[]{1});

        assertThat(result.classification()).isEqualTo(Classification.NORMAL);
        assertThat(result.confidence()).isEqualTo(0.65);
        assertThat(result.source()).isEqualTo("internal");
        assertThat(result.note()).isNull();
    }

    @Test
    @DisplayName("missing fields default to abnormal at 0.85")
    void defaults_on_sparse_answer() {
        when(router.route(eq(AiTask.STAGE1_NORMAL_ABNORMAL), anyMap(), eq("d1")))
                .thenReturn(AiResult.succeeded("openrouter", Map.of("observations", "redness"), 3, false, List.of()));

        ClassificationResult result = classifier.classify("d1", null, new byte[]{1});

        assertThat(result.classification()).isEqualTo(Classification.ABNORMAL);
        assertThat(result.confidence()).isEqualTo(0.85);
    }

    @Test
    @DisplayName("exhausted chain defaults to abnormal, never normal")
    void exhausted_defaults_to_abnormal() {
        when(router.route(eq(AiTask.STAGE1_NORMAL_ABNORMAL), anyMap(), eq("d1")))
                .thenReturn(AiResult.exhausted("stage1_normal_abnormal", List.of()));

        ClassificationResult result = classifier.classify("d1", null, new byte[]{1});

        assertThat(result.classification()).isEqualTo(Classification.ABNORMAL);
        assertThat(result.confidence()).isEqualTo(0.5);
        assertThat(result.source()).isEqualTo("fallback_default");
        assertThat(result.fallbackUsed()).isTrue();
        assertThat(result.note()).isEqualTo("Defaulted to abnormal due to AI failure");
    }
}
