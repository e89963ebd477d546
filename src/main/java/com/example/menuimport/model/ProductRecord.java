package com.example.menuimport.model;

public record ProductRecord(
        String id,
        String name,
        String brand,
        Double thc,
        Double terpenes,
        String type,
        double price,
        String netWeight,
        boolean lowStock,
        boolean soldOut,
        String notes) implements ImportRecord {
}
