package com.formula.smartsheet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formula.exception.MappingException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses location mappings from a JSON array:
 * {@code [{"field": "Status", "location": "A2"}, ...]}.
 */
public final class MappingJsonParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private MappingJsonParser() {
    }

    public static List<LocationMapping> parse(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }

        List<LocationMapping> parsed;
        try {
            parsed = objectMapper.readValue(json, new TypeReference<List<LocationMapping>>() {});
        } catch (JsonProcessingException e) {
            throw new MappingException("Invalid location mappings JSON: " + e.getOriginalMessage(), e);
        }

        List<LocationMapping> mappings = new ArrayList<>();
        for (int i = 0; i < parsed.size(); i++) {
            LocationMapping mapping = parsed.get(i);
            if (mapping == null || isBlank(mapping.field())) {
                throw new MappingException("Mapping " + (i + 1) + " is missing 'field'");
            }
            if (isBlank(mapping.location())) {
                throw new MappingException("Mapping " + (i + 1) + " is missing 'location'");
            }
            mappings.add(mapping.withDefaults());
        }
        return mappings;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
