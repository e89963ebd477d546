package com.example.menuimport.worker;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldMappingTest {

    @Test
    void invertsColumnToFieldMapping() {
        FieldMapping mapping = FieldMapping.invert(Map.of("Category", "shelf", "Strain Name", "name"));

        assertThat(mapping.columnFor(FieldMapping.SHELF)).contains("Category");
        assertThat(mapping.columnFor(FieldMapping.NAME)).contains("Strain Name");
        assertThat(mapping.columnFor(FieldMapping.THC)).isEmpty();
    }

    @Test
    void laterColumnWinsForDuplicateField() {
        Map<String, String> columnMapping = new LinkedHashMap<>();
        columnMapping.put("Tier", "shelf");
        columnMapping.put("Category", "shelf");

        FieldMapping mapping = FieldMapping.invert(columnMapping);

        assertThat(mapping.columnFor(FieldMapping.SHELF)).contains("Category");
        assertThat(mapping.asMap()).hasSize(1);
    }

    @Test
    void valueIsEmptyForUnmappedFieldOrAbsentCell() {
        FieldMapping mapping = FieldMapping.invert(Map.of("THC %", "thc"));
        Map<String, String> row = Map.of("Name", "Blue Dream");

        assertThat(mapping.value(row, FieldMapping.THC)).isEmpty();
        assertThat(mapping.value(row, FieldMapping.NAME)).isEmpty();
        assertThat(mapping.value(Map.of("THC %", "21%"), FieldMapping.THC)).isEqualTo("21%");
    }

    @Test
    void ignoresBlankFieldNames() {
        Map<String, String> columnMapping = new LinkedHashMap<>();
        columnMapping.put("Unused", "");
        columnMapping.put("Name", "name");

        assertThat(FieldMapping.invert(columnMapping).asMap()).containsOnlyKeys("name");
        assertThat(FieldMapping.invert(null).asMap()).isEmpty();
    }
}
