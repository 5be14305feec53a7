package com.skindx.infrastructure.ai.pipeline;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.infrastructure.ai.routing.AiResult;
import com.skindx.infrastructure.ai.routing.AiRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

import static com.skindx.infrastructure.ai.TaskInputKeys.*;

/**
 * Single entry point from stage modules into the router.
 * <p>
 * By default every stage gets one pass over its provider chain. With
 * {@code skindx.pipeline.retry-exhausted-chains=true} an exhausted chain is retried
 * with the router's backoff before the stage applies its fallback.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageDispatcher {

    private final AiRouter router;

    @Value("${skindx.pipeline.retry-exhausted-chains:false}")
    private boolean retryExhaustedChains;

    public AiResult dispatch(AiTask task, Map<String, Object> input, String diagnosisId) {
        if (retryExhaustedChains) {
            return router.routeWithRetry(task, input, diagnosisId, null);
        }
        return router.route(task, input, diagnosisId);
    }

    /**
     * Base input for image tasks. Null image fields are left out.
     */
    Map<String, Object> imageInput(String diagnosisId, String imagePath, byte[] imageBytes) {
        Map<String, Object> input = new HashMap<>();
        input.put(DIAGNOSIS_ID, diagnosisId);
        if (imagePath != null) input.put(IMAGE_PATH, imagePath);
        if (imageBytes != null) input.put(IMAGE_BYTES, imageBytes);
        return input;
    }

    String timestamp() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS).toString();
    }
}
