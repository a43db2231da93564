package com.gastronomico.directory.entity;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonListConverterTest {

    private final JsonListConverter converter = new JsonListConverter();

    @Test
    void nullListIsStoredAsEmptyArray() {
        assertEquals("[]", converter.convertToDatabaseColumn(null));
    }

    @Test
    void missingColumnReadsAsMutableEmptyList() {
        List<Object> fromNull = converter.convertToEntityAttribute(null);
        List<Object> fromBlank = converter.convertToEntityAttribute("  ");

        assertTrue(fromNull.isEmpty());
        assertTrue(fromBlank.isEmpty());
        fromNull.add("still writable");
    }

    @Test
    void branchStructureSurvivesStorage() {
        List<Object> branches = new ArrayList<>();
        branches.add(Map.of(
                "address", "Av. Larco 123, Miraflores",
                "schedule", "12:00 - 23:00",
                "phones", List.of("01-555-1234", "987654321")));
        branches.add(Map.of("address", "Jr. de la Unión 5", "tables", 12, "delivery", true));

        String column = converter.convertToDatabaseColumn(branches);
        List<Object> restored = converter.convertToEntityAttribute(column);

        assertEquals(branches, restored);
    }

    @Test
    void corruptColumnIsReported() {
        assertThrows(IllegalStateException.class, () -> converter.convertToEntityAttribute("{not json"));
    }
}
