package com.skindx.domain.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only entry of the disease reference table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiseaseReference(
        String id,
        LocalizedText name,
        String category,
        String subcategory,
        @JsonProperty("severity_range") List<String> severityRange,
        String urgency,
        LocalizedText description
) {}
