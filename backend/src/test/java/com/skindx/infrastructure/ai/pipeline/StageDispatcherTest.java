package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.infrastructure.ai.routing.AiResult;
import com.skindx.infrastructure.ai.routing.AiRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.skindx.infrastructure.ai.TaskInputKeys.DIAGNOSIS_ID;
import static com.skindx.infrastructure.ai.TaskInputKeys.IMAGE_BYTES;
import static com.skindx.infrastructure.ai.TaskInputKeys.IMAGE_PATH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StageDispatcherTest {

    private static final Map<String, Object> INPUT = Map.of("category", "infectious");

    @Mock
    private AiRouter router;

    private StageDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new StageDispatcher(router);
    }

    private void setRetryExhaustedChains(boolean value) throws Exception {
        Field field = StageDispatcher.class.getDeclaredField("retryExhaustedChains");
        field.setAccessible(true);
        field.set(dispatcher, value);
    }

    @Test
    @DisplayName("one pass over the chain by default")
    void single_pass_by_default() {
        AiResult result = AiResult.succeeded("internal", Map.of("disease", "scabies"), 2, false, List.of());
        when(router.route(AiTask.STAGE3_DIAGNOSIS, INPUT, "d1")).thenReturn(result);

        assertThat(dispatcher.dispatch(AiTask.STAGE3_DIAGNOSIS, INPUT, "d1")).isSameAs(result);
        verify(router, never()).routeWithRetry(any(), anyMap(), anyString(), any());
    }

    @Test
    @DisplayName("exhausted chains are retried when enabled")
    void retry_when_enabled() throws Exception {
        setRetryExhaustedChains(true);
        AiResult exhausted = AiResult.exhausted("stage3_diagnosis", List.of());
        when(router.routeWithRetry(eq(AiTask.STAGE3_DIAGNOSIS), eq(INPUT), eq("d1"), isNull())).thenReturn(exhausted);

        assertThat(dispatcher.dispatch(AiTask.STAGE3_DIAGNOSIS, INPUT, "d1")).isSameAs(exhausted);
        verify(router, never()).route(any(), anyMap(), anyString());
    }

    @Test
    void image_input_leaves_out_missing_fields() {
        Map<String, Object> withBytes = dispatcher.imageInput("d1", null, new byte[]{1, 2});
        assertThat(withBytes).containsOnlyKeys(DIAGNOSIS_ID, IMAGE_BYTES);

        Map<String, Object> withPath = dispatcher.imageInput("d1", "/tmp/lesion.jpg", null);
        assertThat(withPath).containsEntry(IMAGE_PATH, "/tmp/lesion.jpg").doesNotContainKey(IMAGE_BYTES);

        withPath.put("classes", List.of("normal", "abnormal"));
        assertThat(withPath).containsKey("classes");
    }

    @Test
    void timestamp_is_iso_instant_in_millis() {
        String timestamp = dispatcher.timestamp();

        assertThat(Instant.parse(timestamp).getNano() % 1_000_000).isZero();
    }
}
