package com.example.menuimport.model;

import java.util.List;
import java.util.Map;

public record ImportResult(
        Map<String, List<ImportRecord>> shelfAssignments,
        List<DestinationDescriptor> createdShelves,
        List<SkippedRow> skippedRows,
        ImportStats stats) {
}
