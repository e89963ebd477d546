package com.example.menuimport.model;

public record CsvUpload(String filename, UploadEncoding encoding, CsvTable table) {
}
