package com.jordtransport.manifest.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum FuelType {
    DIESEL("diesel"),
    BENZIN("benzin"),
    EL("el"),
    HYBRID("hybrid");

    private final String label;

    FuelType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<FuelType> fromLabel(String value) {
        if (value == null) return Optional.empty();
        String candidate = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.label.equals(candidate))
                .findFirst();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(FuelType::getLabel).collect(Collectors.toList());
    }
}
