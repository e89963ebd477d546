package com.example.menuimport.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * How an uploaded CSV file was stored on the wire.
 */
public enum UploadEncoding {
    PLAIN,
    GZIP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
