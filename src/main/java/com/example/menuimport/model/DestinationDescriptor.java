package com.example.menuimport.model;

public record DestinationDescriptor(String id, String name) {
}
