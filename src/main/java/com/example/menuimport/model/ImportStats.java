package com.example.menuimport.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportStats(
        int totalProcessed,
        int totalSkipped,
        Integer shakeCount,
        Integer flowerCount) {
}
