package com.example.menuimport.model;

import java.util.List;
import java.util.Map;

/**
 * Decoded CSV content: header names in file order and one map per data row keyed by header.
 */
public record CsvTable(List<String> headers, List<Map<String, String>> rows) {

    public static final CsvTable EMPTY = new CsvTable(List.of(), List.of());
}
