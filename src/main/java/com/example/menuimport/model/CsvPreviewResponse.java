package com.example.menuimport.model;

import java.util.List;
import java.util.Map;

public record CsvPreviewResponse(
        String filename,
        UploadEncoding encoding,
        List<String> headers,
        int rowCount,
        ImportMode detectedMode,
        Map<String, String> suggestedMapping,
        List<String> missingRequiredFields) {
}
