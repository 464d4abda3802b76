package com.jordtransport.manifest.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum VehicleType {
    PERSONBIL("Personbil"),
    LASTBIL("Lastbil"),
    VAREBIL("Varebil"),
    TRAILER("Trailer");

    private final String label;

    VehicleType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Case-insensitive lookup of a trimmed label ("lastbil", "LASTBIL" and "Lastbil" all match).
     */
    public static Optional<VehicleType> fromLabel(String value) {
        if (value == null) return Optional.empty();
        String candidate = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.label.toLowerCase(Locale.ROOT).equals(candidate))
                .findFirst();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(VehicleType::getLabel).collect(Collectors.toList());
    }
}
