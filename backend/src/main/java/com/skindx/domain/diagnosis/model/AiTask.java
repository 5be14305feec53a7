package com.skindx.domain.diagnosis.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of routable inference tasks, one per pipeline stage.
 */
public enum AiTask {
    STAGE0_VALIDATION("stage0_validation"),
    STAGE1_NORMAL_ABNORMAL("stage1_normal_abnormal"),
    STAGE2_CATEGORY("stage2_category"),
    STAGE3_DIAGNOSIS("stage3_diagnosis"),
    STAGE4_FUSION("stage4_fusion");

    private final String configKey;

    AiTask(String configKey) {
        this.configKey = configKey;
    }

    /**
     * Key used in the routing config file and in AI call records.
     */
    public String configKey() {
        return configKey;
    }

    public static Optional<AiTask> fromConfigKey(String key) {
        return Arrays.stream(values())
                .filter(t -> t.configKey.equals(key))
                .findFirst();
    }

    @Override
    public String toString() {
        return configKey;
    }
}
