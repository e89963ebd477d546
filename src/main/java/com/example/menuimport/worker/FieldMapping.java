package com.example.menuimport.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field to CSV column lookup, built by inverting the caller's column to field mapping. When two
 * columns name the same field the later one wins.
 */
public final class FieldMapping {

    public static final String SHELF = "shelf";
    public static final String NAME = "name";
    public static final String GROWER = "grower";
    public static final String BRAND = "brand";
    public static final String THC = "thc";
    public static final String TERPENES = "terpenes";
    public static final String TYPE = "type";
    public static final String PRICE = "price";
    public static final String NET_WEIGHT = "netWeight";
    public static final String LAST_JAR = "lastJar";
    public static final String SOLD_OUT = "soldOut";
    public static final String LOW_STOCK = "isLowStock";
    public static final String ORIGINAL_SHELF = "originalShelf";
    public static final String NOTES = "notes";

    private final Map<String, String> fieldToColumn;

    private FieldMapping(Map<String, String> fieldToColumn) {
        this.fieldToColumn = Collections.unmodifiableMap(fieldToColumn);
    }

    public static FieldMapping invert(Map<String, String> columnMapping) {
        Map<String, String> inverted = new LinkedHashMap<>();
        if (columnMapping != null) {
            columnMapping.forEach((csvColumn, field) -> {
                if (csvColumn != null && field != null && !field.isBlank()) {
                    inverted.put(field, csvColumn);
                }
            });
        }
        return new FieldMapping(inverted);
    }

    public Optional<String> columnFor(String field) {
        return Optional.ofNullable(fieldToColumn.get(field));
    }

    /**
     * Cell value for a field, or an empty string when the field is unmapped or the cell is absent.
     */
    public String value(Map<String, String> row, String field) {
        String column = fieldToColumn.get(field);
        if (column == null) {
            return "";
        }
        String value = row.get(column);
        return value == null ? "" : value;
    }

    public Map<String, String> asMap() {
        return fieldToColumn;
    }
}
