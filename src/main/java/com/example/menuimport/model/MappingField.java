package com.example.menuimport.model;

import java.util.Arrays;
import java.util.List;

/**
 * Target fields a CSV column can be mapped onto, per import mode. The aliases drive header
 * auto-mapping.
 */
public enum MappingField {
    BULK_SHELF(ImportMode.BULK, "shelf", true, "category", "shelf", "tier", "section", "group"),
    BULK_NAME(ImportMode.BULK, "name", true, "strain name", "strain", "product", "flower", "name", "product name"),
    BULK_GROWER(ImportMode.BULK, "grower", false, "brand", "grower", "grow/brand", "grower/brand", "company",
            "producer", "cultivator"),
    BULK_THC(ImportMode.BULK, "thc", false, "thc", "thc%", "thc percent", "thc percentage", "thc %"),
    BULK_TYPE(ImportMode.BULK, "type", false, "class", "type", "strain type", "classification"),
    BULK_LAST_JAR(ImportMode.BULK, "lastJar", false, "last jar", "lastjar", "final", "remaining", "last"),
    BULK_ORIGINAL_SHELF(ImportMode.BULK, "originalShelf", false, "original shelf", "original", "source shelf",
            "source"),

    PREPACKAGED_SHELF(ImportMode.PREPACKAGED, "shelf", true, "category", "shelf", "weight", "size"),
    PREPACKAGED_NAME(ImportMode.PREPACKAGED, "name", true, "product name", "strain", "name", "flower"),
    PREPACKAGED_BRAND(ImportMode.PREPACKAGED, "brand", false, "brand", "grower", "company", "producer"),
    PREPACKAGED_THC(ImportMode.PREPACKAGED, "thc", false, "thc", "thc%", "thc percent"),
    PREPACKAGED_TERPENES(ImportMode.PREPACKAGED, "terpenes", false, "terpenes", "terp", "terp%", "terpene"),
    PREPACKAGED_TYPE(ImportMode.PREPACKAGED, "type", false, "class", "type", "strain type"),
    PREPACKAGED_PRICE(ImportMode.PREPACKAGED, "price", true, "price", "cost", "amount"),
    PREPACKAGED_NET_WEIGHT(ImportMode.PREPACKAGED, "netWeight", false, "net weight", "weight", "net wt",
            "netweight"),
    PREPACKAGED_LOW_STOCK(ImportMode.PREPACKAGED, "isLowStock", false, "low stock", "lowstock", "stock status",
            "inventory"),
    PREPACKAGED_NOTES(ImportMode.PREPACKAGED, "notes", false, "notes", "comments", "remarks", "description");

    private final ImportMode mode;
    private final String key;
    private final boolean required;
    private final List<String> aliases;

    MappingField(ImportMode mode, String key, boolean required, String... aliases) {
        this.mode = mode;
        this.key = key;
        this.required = required;
        this.aliases = List.of(aliases);
    }

    public ImportMode mode() {
        return mode;
    }

    public String key() {
        return key;
    }

    public boolean required() {
        return required;
    }

    public List<String> aliases() {
        return aliases;
    }

    public static List<MappingField> forMode(ImportMode mode) {
        return Arrays.stream(values())
                .filter(field -> field.mode == mode)
                .toList();
    }
}
