package com.jordtransport.manifest.validation;

import lombok.Value;

/**
 * Advisory finding. Warnings are reported alongside the result but never decide whether a row is accepted.
 */
@Value
public class FieldWarning {

    public static final String COLUMNS = "Kolonner";

    /**
     * Column the warning is about, or {@link #COLUMNS} for header-level warnings.
     */
    String field;

    /**
     * Row number, or null for warnings about the file as a whole.
     */
    Integer rowIndex;

    String message;

    String value;

    /**
     * What the uploader might do about it; may be null.
     */
    String suggestion;

    public static FieldWarning forFile(String field, String message, String suggestion) {
        return new FieldWarning(field, null, message, null, suggestion);
    }

    @Override
    public String toString() {
        String base = rowIndex != null
                ? "Række " + rowIndex + ", felt '" + field + "': " + message
                : "Felt '" + field + "': " + message;
        return suggestion != null ? base + " (Forslag: " + suggestion + ")" : base;
    }
}
