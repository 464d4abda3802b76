package com.jordtransport.manifest.validation;

import com.jordtransport.manifest.exception.MissingColumnsException;
import com.jordtransport.manifest.parser.CellValues;
import com.jordtransport.manifest.parser.RawRow;
import com.jordtransport.manifest.reference.ReferenceDirectory;
import com.jordtransport.manifest.schema.ColumnDefinition;
import com.jordtransport.manifest.schema.FuelType;
import com.jordtransport.manifest.schema.SchemaDefinition;
import com.jordtransport.manifest.schema.VehicleType;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.jordtransport.manifest.schema.SchemaDefinition.*;

/**
 * Applies the column contract and the facility directory to manifest rows.
 * <p>
 * The header is checked once per file ({@link #checkHeader}); rows are then checked one at a time
 * ({@link #validate}). Row checks do not stop at the first failure: every applicable check runs so the
 * uploader sees everything wrong with a row in one pass. Instances hold no mutable state and may be shared
 * across threads.
 */
@RequiredArgsConstructor
public class RowValidator {

    public static final double HIGH_LOAD_WEIGHT_KG = 50_000;
    public static final int ADDRESS_MIN_LENGTH = 5;
    public static final int ADDRESS_MAX_LENGTH = 200;

    /**
     * Optional columns that feed later reporting; a header without them gets a warning.
     */
    public static final List<String> USEFUL_OPTIONAL_COLUMNS = List.of(NAVN, BRAENDSTOF_TYPE, LAST_VAEGT, KOERETOEJS_TYPE);

    private static final Pattern LETTER = Pattern.compile("[a-zA-ZæøåÆØÅ]");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final SchemaDefinition schema;
    private final ReferenceDirectory directory;

    /**
     * @throws MissingColumnsException naming every mandatory column the header lacks
     */
    public void checkHeader(List<String> header) {
        List<String> missing = schema.missingMandatoryColumns(header);
        if (!missing.isEmpty()) {
            throw new MissingColumnsException(missing);
        }
    }

    /**
     * @return every constraint the row violates, in column order; empty when the row is valid
     */
    public List<FieldError> validate(RawRow row) {
        List<FieldError> errors = new ArrayList<>();

        for (ColumnDefinition column : schema.getMandatoryColumns()) {
            if (row.isBlank(column.getName())) {
                errors.add(error(row, column.getName(), ErrorCode.REQUIRED_FIELD_MISSING, "Obligatorisk felt er tomt"));
            }
        }

        if (!row.isBlank(POSTNUMMER)) {
            checkPostalCode(row, errors);
        }
        if (!row.isBlank(MODTAGERANLAEG_ID)) {
            checkFacilityId(row, errors);
        }
        if (!row.isBlank(DATO) && ValueParsers.parseIsoDate(row.get(DATO)).isEmpty()) {
            errors.add(error(row, DATO, ErrorCode.INVALID_DATE_FORMAT,
                    "Ugyldigt datoformat: '" + row.text(DATO) + "'. Brug formatet ÅÅÅÅ-MM-DD"));
        }
        if (!row.isBlank(KOERETOEJS_TYPE) && VehicleType.fromLabel(row.text(KOERETOEJS_TYPE)).isEmpty()) {
            errors.add(error(row, KOERETOEJS_TYPE, ErrorCode.INVALID_ENUM_VALUE,
                    "Ugyldig køretøjstype: '" + row.text(KOERETOEJS_TYPE) + "'. Gyldige værdier: "
                            + String.join(", ", VehicleType.labels())));
        }
        if (!row.isBlank(LAST_VAEGT)) {
            checkLoadWeight(row, errors);
        }
        if (!row.isBlank(BRAENDSTOF_TYPE) && FuelType.fromLabel(row.text(BRAENDSTOF_TYPE)).isEmpty()) {
            errors.add(error(row, BRAENDSTOF_TYPE, ErrorCode.INVALID_ENUM_VALUE,
                    "Ugyldig brændstoftype: '" + row.text(BRAENDSTOF_TYPE) + "'. Gyldige værdier: "
                            + String.join(", ", FuelType.labels())));
        }

        errors.sort((a, b) -> Integer.compare(columnPosition(a.getField()), columnPosition(b.getField())));
        return errors;
    }

    /**
     * Advisory findings about the header: useful optional columns that are absent and columns the contract
     * does not know.
     */
    public List<FieldWarning> headerWarnings(List<String> header) {
        List<FieldWarning> warnings = new ArrayList<>();

        List<String> missingUseful = new ArrayList<>();
        for (String column : USEFUL_OPTIONAL_COLUMNS) {
            if (!header.contains(column)) missingUseful.add(column);
        }
        if (!missingUseful.isEmpty()) {
            warnings.add(FieldWarning.forFile(FieldWarning.COLUMNS,
                    "Manglende nyttige kolonner: " + String.join(", ", missingUseful),
                    "Tilføj disse kolonner for bedre rapportering"));
        }
        for (String column : schema.unknownColumns(header)) {
            warnings.add(FieldWarning.forFile(column, "Ukendt kolonne '" + column + "' fundet",
                    "Fjern eller omdøb kolonne for bedre kompatibilitet"));
        }
        return warnings;
    }

    /**
     * Advisory findings about one row. These never reject the row; a row can be both rejected and warned about.
     */
    public List<FieldWarning> warnings(RawRow row) {
        List<FieldWarning> warnings = new ArrayList<>();

        long filled = row.getValues().values().stream().filter(v -> !CellValues.isBlank(v)).count();
        if (filled < schema.getMandatoryColumns().size()) {
            warnings.add(new FieldWarning("Rækkedata", row.getRowIndex(), "Række har kun " + filled + " udfyldte felter",
                    null, "Kontroller at alle obligatoriske felter er udfyldt"));
        }

        String address = row.text(ADRESSE);
        if (!address.isEmpty() && !isPlausibleAddress(address)) {
            warnings.add(new FieldWarning(ADRESSE, row.getRowIndex(), "Adresse format ser ikke korrekt ud: '" + address + "'",
                    address, "En adresse har normalt både vejnavn og husnummer"));
        }

        ValueParsers.parseDecimal(row.get(LAST_VAEGT))
                .filter(weight -> weight > HIGH_LOAD_WEIGHT_KG)
                .ifPresent(weight -> warnings.add(new FieldWarning(LAST_VAEGT, row.getRowIndex(),
                        "Meget høj vægt: " + row.text(LAST_VAEGT) + " kg", row.text(LAST_VAEGT),
                        "Kontroller at vægten er korrekt")));
        return warnings;
    }

    static boolean isPlausibleAddress(String address) {
        String trimmed = address.trim();
        return trimmed.length() >= ADDRESS_MIN_LENGTH
                && trimmed.length() <= ADDRESS_MAX_LENGTH
                && LETTER.matcher(trimmed).find()
                && DIGIT.matcher(trimmed).find();
    }

    private void checkPostalCode(RawRow row, List<FieldError> errors) {
        Optional<BigDecimal> postalCode = ValueParsers.parseInteger(row.get(POSTNUMMER));
        if (postalCode.isEmpty()) {
            errors.add(error(row, POSTNUMMER, ErrorCode.INVALID_TYPE,
                    "Ugyldigt postnummer format: '" + row.text(POSTNUMMER) + "'"));
        } else if (postalCode.get().compareTo(BigDecimal.valueOf(POSTAL_CODE_MIN)) < 0
                || postalCode.get().compareTo(BigDecimal.valueOf(POSTAL_CODE_MAX)) > 0) {
            errors.add(error(row, POSTNUMMER, ErrorCode.POSTAL_CODE_OUT_OF_RANGE,
                    "Postnummer " + row.text(POSTNUMMER) + " er ikke i det gyldige område ("
                            + POSTAL_CODE_MIN + "-" + POSTAL_CODE_MAX + ")"));
        }
    }

    private void checkFacilityId(RawRow row, List<FieldError> errors) {
        if (ValueParsers.parseInteger(row.get(MODTAGERANLAEG_ID)).isEmpty()) {
            errors.add(error(row, MODTAGERANLAEG_ID, ErrorCode.INVALID_TYPE,
                    "ModtageranlægID skal være et heltal: '" + row.text(MODTAGERANLAEG_ID) + "'"));
            return;
        }
        // Whole numbers beyond int range cannot be directory entries
        Optional<Integer> facilityId = ValueParsers.parseWholeNumber(row.get(MODTAGERANLAEG_ID));
        if (facilityId.isEmpty() || !directory.contains(facilityId.get())) {
            errors.add(error(row, MODTAGERANLAEG_ID, ErrorCode.UNKNOWN_FACILITY_ID,
                    "Ukendt anlæg ID: " + row.text(MODTAGERANLAEG_ID) + ". Gyldige værdier: " + directory.getFacilityIds()));
        }
    }

    private void checkLoadWeight(RawRow row, List<FieldError> errors) {
        Optional<Double> weight = ValueParsers.parseDecimal(row.get(LAST_VAEGT));
        if (weight.isEmpty()) {
            errors.add(error(row, LAST_VAEGT, ErrorCode.INVALID_TYPE,
                    "Ugyldigt vægt format: '" + row.text(LAST_VAEGT) + "'. LastVægt skal være et tal"));
        } else if (weight.get() <= 0) {
            errors.add(error(row, LAST_VAEGT, ErrorCode.INVALID_TYPE,
                    "LastVægt skal være et positivt tal: " + row.text(LAST_VAEGT)));
        }
    }

    private int columnPosition(String field) {
        int position = schema.getColumnNames().indexOf(field);
        return position < 0 ? Integer.MAX_VALUE : position;
    }

    private FieldError error(RawRow row, String field, ErrorCode code, String message) {
        return new FieldError(field, row.getRowIndex(), code, message, row.text(field));
    }
}
