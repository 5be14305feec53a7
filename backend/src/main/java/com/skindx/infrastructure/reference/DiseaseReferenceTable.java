package com.skindx.infrastructure.reference;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skindx.domain.diagnosis.model.DiseaseReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only disease table, loaded once at startup.
 */
@Slf4j
@Component
public class DiseaseReferenceTable {

    private final Map<String, DiseaseReference> byId;
    private final List<DiseaseReference> ordered;

    @Autowired
    public DiseaseReferenceTable(ObjectMapper objectMapper,
                                 @Value("${skindx.reference.diseases:classpath:diseases.json}") Resource resource) {
        this(read(objectMapper, resource));
        log.info("[Reference] Loaded {} diseases from {}", byId.size(), resource.getDescription());
    }

    public DiseaseReferenceTable(List<DiseaseReference> diseases) {
        Map<String, DiseaseReference> index = new LinkedHashMap<>();
        for (DiseaseReference disease : diseases) {
            index.put(disease.id(), disease);
        }
        this.byId = Map.copyOf(index);
        this.ordered = List.copyOf(index.values());
    }

    public Optional<DiseaseReference> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Diseases of one category, in table order.
     */
    public List<DiseaseReference> findByCategory(String category) {
        return ordered.stream()
                .filter(d -> d.category() != null && d.category().equals(category))
                .toList();
    }

    public List<DiseaseReference> all() {
        return ordered;
    }

    private static List<DiseaseReference> read(ObjectMapper objectMapper, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            return objectMapper.convertValue(root.path("diseases"), new TypeReference<List<DiseaseReference>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read disease table " + resource.getDescription(), e);
        }
    }
}
