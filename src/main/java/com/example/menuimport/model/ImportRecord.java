package com.example.menuimport.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A normalized row filed into a destination. Bulk imports produce {@link StrainRecord}s,
 * prepackaged imports produce {@link ProductRecord}s.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StrainRecord.class, name = "strain"),
        @JsonSubTypes.Type(value = ProductRecord.class, name = "product")
})
public sealed interface ImportRecord permits StrainRecord, ProductRecord {

    String id();

    String name();

    Double thc();

    String type();

    boolean soldOut();
}
