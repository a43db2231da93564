package com.gastronomico.directory.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a free-form JSON array in a text column. Elements come back as
 * the plain Jackson tree types (maps, lists, strings, numbers, booleans).
 */
@Converter
public class JsonListConverter implements AttributeConverter<List<Object>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(List<Object> list) {
        if (list == null) return "[]";
        try {
            return MAPPER.writeValueAsString(list);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to serialize JSON list", e);
        }
    }

    @Override
    public List<Object> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return MAPPER.readValue(json, new TypeReference<List<Object>>() {});
        } catch (Exception e) {
            throw new IllegalStateException("Failed to deserialize JSON list", e);
        }
    }
}
