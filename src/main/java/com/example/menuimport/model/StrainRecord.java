package com.example.menuimport.model;

public record StrainRecord(
        String id,
        String name,
        String grower,
        Double thc,
        String type,
        boolean lastJar,
        boolean soldOut,
        String originalShelf) implements ImportRecord {
}
