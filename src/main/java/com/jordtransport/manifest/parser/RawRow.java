package com.jordtransport.manifest.parser;

import lombok.Value;

import java.util.Map;

@Value
public class RawRow {
    /**
     * 1-based position below the header row in the uploaded file.
     */
    int rowIndex;

    /**
     * Column name to raw cell value: a String, a Double for numeric spreadsheet cells, or null when the cell
     * was empty or the column is missing from this row.
     */
    Map<String, Object> values;

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Trimmed text form of a cell, "" when absent.
     */
    public String text(String column) {
        return CellValues.asText(values.get(column));
    }

    public boolean isBlank(String column) {
        return text(column).isEmpty();
    }
}
