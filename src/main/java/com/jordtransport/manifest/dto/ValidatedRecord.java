package com.jordtransport.manifest.dto;

import com.jordtransport.manifest.reference.Facility;
import com.jordtransport.manifest.schema.FuelType;
import com.jordtransport.manifest.schema.VehicleType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A manifest row that passed every check, with its values normalised and its facility resolved.
 * Optional columns that were absent or blank are null.
 */
@Value
@Builder
public class ValidatedRecord {
    int rowIndex;

    String originAddress;
    int postalCode;
    String district;

    /**
     * Resolved from ModtageranlægID so callers never query the directory again.
     */
    Facility facility;

    String name;
    LocalDate date;
    VehicleType vehicleType;
    Double loadWeightKg;
    FuelType fuelType;

    /**
     * Origin formatted for geocoding and display, e.g. "Nørregade 10, 1000 København".
     */
    public String getStartAddress() {
        return originAddress + ", " + postalCode + " " + district;
    }
}
