package com.skindx.infrastructure.reference;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skindx.domain.diagnosis.model.DiseaseCategory;
import com.skindx.domain.diagnosis.model.Specialty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Maps a disease category to the specialty that reviews it.
 */
@Slf4j
@Component
public class SpecialtyDirectory {

    public static final String DEFAULT_SPECIALTY = "general_dermatology";

    private final List<Specialty> specialties;

    @Autowired
    public SpecialtyDirectory(ObjectMapper objectMapper,
                              @Value("${skindx.reference.specialties:classpath:specialties.json}") Resource resource) {
        this(read(objectMapper, resource));
        log.info("[Reference] Loaded {} specialties from {}", specialties.size(), resource.getDescription());
    }

    public SpecialtyDirectory(List<Specialty> specialties) {
        this.specialties = List.copyOf(specialties);
    }

    /**
     * First specialty (in file order) handling the category, else {@value #DEFAULT_SPECIALTY}.
     */
    public String specialtyFor(DiseaseCategory category) {
        if (category == null) return DEFAULT_SPECIALTY;
        return specialties.stream()
                .filter(s -> s.handles(category.id()))
                .map(Specialty::id)
                .findFirst()
                .orElse(DEFAULT_SPECIALTY);
    }

    public List<Specialty> all() {
        return specialties;
    }

    private static List<Specialty> read(ObjectMapper objectMapper, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            return objectMapper.convertValue(root.path("specialties"), new TypeReference<List<Specialty>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read specialty table " + resource.getDescription(), e);
        }
    }
}
