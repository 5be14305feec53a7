package com.skindx.domain.diagnosis.model;

import java.util.Map;

/**
 * User-facing text in English and Arabic. Arabic may be null when a provider only
 * answered in English.
 */
public record LocalizedText(String en, String ar) {

    public static LocalizedText english(String en) {
        return new LocalizedText(en, null);
    }

    /**
     * Accepts either a plain string or an {@code {"en": .., "ar": ..}} map as returned by providers.
     */
    public static LocalizedText from(Object raw) {
        if (raw == null) return null;
        if (raw instanceof LocalizedText text) return text;
        if (raw instanceof Map<?, ?> map) {
            Object en = map.get("en");
            Object ar = map.get("ar");
            return new LocalizedText(en != null ? en.toString() : null, ar != null ? ar.toString() : null);
        }
        return english(raw.toString());
    }
}
