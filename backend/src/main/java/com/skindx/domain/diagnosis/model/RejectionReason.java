package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why the validation gate refused an image, with the guidance shown to the user.
 */
public enum RejectionReason {
    NOT_SKIN_IMAGE(new LocalizedText(
            "Please upload a clear photo of the affected skin area.",
            "يرجى تحميل صورة واضحة للمنطقة المصابة من الجلد.")),
    POOR_IMAGE_QUALITY(new LocalizedText(
            "The image quality is too low. Please upload a clearer, well-lit photo.",
            "جودة الصورة منخفضة جدًا. يرجى تحميل صورة أوضح وذات إضاءة جيدة.")),
    NOT_MEDICAL_IMAGE(new LocalizedText(
            "This image does not appear to show a skin condition. Please upload a photo of the affected area.",
            "لا يبدو أن هذه الصورة تظهر حالة جلدية. يرجى تحميل صورة للمنطقة المصابة.")),
    VALIDATION_FAILED(new LocalizedText(
            "We could not process this image. Please try again with a different photo.",
            "لم نتمكن من معالجة هذه الصورة. يرجى المحاولة مرة أخرى بصورة مختلفة."));

    private final LocalizedText guidance;

    RejectionReason(LocalizedText guidance) {
        this.guidance = guidance;
    }

    public LocalizedText guidance() {
        return guidance;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
