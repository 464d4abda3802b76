package com.jordtransport.manifest.service;

import com.jordtransport.manifest.dto.ValidatedRecord;
import com.jordtransport.manifest.parser.RawRow;
import com.jordtransport.manifest.reference.Facility;
import com.jordtransport.manifest.reference.ReferenceDirectory;
import com.jordtransport.manifest.schema.FuelType;
import com.jordtransport.manifest.schema.VehicleType;
import com.jordtransport.manifest.validation.FieldError;
import com.jordtransport.manifest.validation.ValueParsers;
import lombok.RequiredArgsConstructor;

import java.util.List;

import static com.jordtransport.manifest.schema.SchemaDefinition.*;

/**
 * Builds typed records from rows that {@link com.jordtransport.manifest.validation.RowValidator} passed.
 */
@RequiredArgsConstructor
public class RecordAssembler {

    private final ReferenceDirectory directory;

    /**
     * @param row    a validated row
     * @param errors the validator's result for that row; must be empty
     * @throws IllegalArgumentException if {@code errors} is not empty
     */
    public ValidatedRecord assemble(RawRow row, List<FieldError> errors) {
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Row " + row.getRowIndex() + " has " + errors.size()
                    + " validation error(s) and cannot be assembled");
        }

        int facilityId = ValueParsers.parseWholeNumber(row.get(MODTAGERANLAEG_ID))
                .orElseThrow(() -> invalid(row, MODTAGERANLAEG_ID));
        Facility facility = directory.find(facilityId)
                .orElseThrow(() -> invalid(row, MODTAGERANLAEG_ID));

        return ValidatedRecord.builder()
                .rowIndex(row.getRowIndex())
                .originAddress(row.text(ADRESSE))
                .postalCode(ValueParsers.parseWholeNumber(row.get(POSTNUMMER)).orElseThrow(() -> invalid(row, POSTNUMMER)))
                .district(row.text(POST_DISTRIKT))
                .facility(facility)
                .name(row.isBlank(NAVN) ? null : row.text(NAVN))
                .date(ValueParsers.parseIsoDate(row.get(DATO)).orElse(null))
                .vehicleType(VehicleType.fromLabel(row.text(KOERETOEJS_TYPE)).orElse(null))
                .loadWeightKg(ValueParsers.parseDecimal(row.get(LAST_VAEGT)).orElse(null))
                .fuelType(FuelType.fromLabel(row.text(BRAENDSTOF_TYPE)).orElse(null))
                .build();
    }

    private IllegalArgumentException invalid(RawRow row, String field) {
        return new IllegalArgumentException("Row " + row.getRowIndex() + " was not validated: " + field + " = '"
                + row.text(field) + "'");
    }
}
