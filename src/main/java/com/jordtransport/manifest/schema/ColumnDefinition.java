package com.jordtransport.manifest.schema;

import lombok.Value;

import java.util.List;

@Value
public class ColumnDefinition {
    /**
     * Exact header text expected in the uploaded file, e.g. "Postnummer".
     */
    String name;

    ColumnType type;

    boolean mandatory;

    /**
     * Accepted labels for ENUM columns, in their canonical casing. Empty for every other type.
     */
    List<String> allowedValues;

    public static ColumnDefinition mandatory(String name, ColumnType type) {
        return new ColumnDefinition(name, type, true, List.of());
    }

    public static ColumnDefinition optional(String name, ColumnType type) {
        return new ColumnDefinition(name, type, false, List.of());
    }

    public static ColumnDefinition optionalEnum(String name, List<String> allowedValues) {
        return new ColumnDefinition(name, ColumnType.ENUM, false, List.copyOf(allowedValues));
    }
}
