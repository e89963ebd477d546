package com.example.menuimport.model;

import java.util.List;
import java.util.Map;

public record ImportRequest(
        List<Map<String, String>> rows,
        Map<String, String> columnMapping,
        ImportMode mode,
        List<DestinationDescriptor> existingDestinations,
        boolean allowCreateDestinations) {

    public ImportRequest {
        rows = rows == null ? List.of() : rows;
        columnMapping = columnMapping == null ? Map.of() : columnMapping;
        existingDestinations = existingDestinations == null ? List.of() : existingDestinations;
    }
}
