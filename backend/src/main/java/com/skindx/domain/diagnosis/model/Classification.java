package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Classification {
    NORMAL, ABNORMAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Classification> fromLabel(String label) {
        if (label == null) return Optional.empty();
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "normal" -> Optional.of(NORMAL);
            case "abnormal" -> Optional.of(ABNORMAL);
            default -> Optional.empty();
        };
    }
}
