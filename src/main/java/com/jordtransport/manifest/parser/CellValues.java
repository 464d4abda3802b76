package com.jordtransport.manifest.parser;

import java.math.BigDecimal;

/**
 * Conversions shared by both readers so a spreadsheet number and the same number typed into a CSV file read
 * the same way downstream.
 */
public final class CellValues {

    private CellValues() {
    }

    public static String asText(Object value) {
        if (value == null) return "";
        if (value instanceof Double) {
            double d = (Double) value;
            if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return value.toString().trim();
    }

    public static boolean isBlank(Object value) {
        return asText(value).isEmpty();
    }
}
