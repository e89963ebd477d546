package com.example.menuimport.model;

import java.util.Map;

public record SkippedRow(int rowIndex, Map<String, String> rowData, String reason) {
}
