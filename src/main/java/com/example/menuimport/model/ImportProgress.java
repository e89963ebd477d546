package com.example.menuimport.model;

public record ImportProgress(long processed, long total, String stage) {

    public static ImportProgress initializing(long total) {
        return new ImportProgress(0, total, "Initializing...");
    }

    public int percentage() {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round(processed * 100.0 / total);
    }
}
