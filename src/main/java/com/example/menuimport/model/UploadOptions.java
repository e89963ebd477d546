package com.example.menuimport.model;

import java.util.List;
import java.util.Map;

public record UploadOptions(
        Map<String, String> columnMapping,
        List<DestinationDescriptor> existingDestinations) {
}
