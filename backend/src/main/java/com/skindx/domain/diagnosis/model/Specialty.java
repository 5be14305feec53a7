package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Specialty(
        String id,
        LocalizedText name,
        @JsonProperty("handles_categories") List<String> handlesCategories
) {

    public boolean handles(String category) {
        return handlesCategories != null && handlesCategories.contains(category);
    }
}
