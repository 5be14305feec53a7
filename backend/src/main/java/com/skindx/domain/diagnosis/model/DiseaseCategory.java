package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed disease category set offered to stage 2 providers.
 */
public enum DiseaseCategory {
    INFECTIOUS, INFLAMMATORY, NEOPLASTIC, ALLERGIC, AUTOIMMUNE, PIGMENTARY, GENETIC;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(DiseaseCategory::id).toList();
    }

    public static Optional<DiseaseCategory> fromId(String id) {
        if (id == null) return Optional.empty();
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.id().equals(normalized))
                .findFirst();
    }
}
