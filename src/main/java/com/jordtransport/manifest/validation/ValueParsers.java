package com.jordtransport.manifest.validation;

import com.jordtransport.manifest.parser.CellValues;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient-in-form, strict-in-value parsing of raw cells. Spreadsheet numbers arrive as {@link Double}, CSV
 * numbers as text; both go through here so they are judged identically.
 */
public final class ValueParsers {

    // ISO_LOCAL_DATE alone also takes signed years longer than four digits
    private static final Pattern ISO_DATE_SHAPE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private ValueParsers() {
    }

    /**
     * Whole numbers of any magnitude: "1000", "1000.0", "10000000000" and a numeric cell holding 1000 all parse;
     * "1000.5" and "abc" give empty.
     */
    public static Optional<BigDecimal> parseInteger(Object raw) {
        return toDecimal(raw).filter(d -> d.signum() == 0 || d.stripTrailingZeros().scale() <= 0);
    }

    /**
     * Whole numbers that fit in an int. Use {@link #parseInteger} to tell "not a whole number" apart from
     * "too large".
     */
    public static Optional<Integer> parseWholeNumber(Object raw) {
        return parseInteger(raw).flatMap(d -> {
            try {
                return Optional.of(d.intValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * Finite decimal number. A comma is read as the decimal separator when the text has no period.
     */
    public static Optional<Double> parseDecimal(Object raw) {
        return toDecimal(raw).map(BigDecimal::doubleValue).filter(Double::isFinite);
    }

    /**
     * Calendar date in ISO-8601 form (YYYY-MM-DD). Impossible dates such as 2024-02-30 are rejected.
     */
    public static Optional<LocalDate> parseIsoDate(Object raw) {
        String text = CellValues.asText(raw);
        if (!ISO_DATE_SHAPE.matcher(text).matches()) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<BigDecimal> toDecimal(Object raw) {
        if (raw instanceof Double) {
            double d = (Double) raw;
            return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
        }
        String text = CellValues.asText(raw);
        if (text.isEmpty()) return Optional.empty();
        if (text.indexOf(',') >= 0 && text.indexOf('.') < 0) {
            text = text.replace(',', '.');
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
