package com.jordtransport.manifest.validation;

import com.jordtransport.manifest.exception.FatalErrorCode;
import com.jordtransport.manifest.exception.MissingColumnsException;
import com.jordtransport.manifest.parser.RawRow;
import com.jordtransport.manifest.reference.Facility;
import com.jordtransport.manifest.reference.ReferenceDirectory;
import com.jordtransport.manifest.schema.SchemaDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("RowValidator")
class RowValidatorTest {

    private final RowValidator validator = new RowValidator(SchemaDefinition.standard(), ReferenceDirectory.standard());

    static Map<String, Object> templateRow() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Adresse", "Nørregade 10");
        values.put("Postnummer", "1000");
        values.put("PostDistrikt", "København");
        values.put("ModtageranlægID", "1061");
        values.put("Navn", "ABC Transport");
        values.put("Dato", "2024-08-26");
        values.put("KøretøjsType", "Lastbil");
        values.put("LastVægt", "2500");
        values.put("Brændstoftype", "diesel");
        return values;
    }

    private static RawRow row(Map<String, Object> values) {
        return new RawRow(7, values);
    }

    private static RawRow templateWith(String column, Object value) {
        Map<String, Object> values = templateRow();
        values.put(column, value);
        return row(values);
    }

    @Test
    @DisplayName("the template example row is valid")
    void templateRowIsValid() {
        assertThat(validator.validate(row(templateRow()))).isEmpty();
    }

    @Test
    @DisplayName("numeric spreadsheet cells validate like their text form")
    void numericCells() {
        Map<String, Object> values = templateRow();
        values.put("Postnummer", 1000.0);
        values.put("ModtageranlægID", 1061.0);
        values.put("LastVægt", 2500.0);

        assertThat(validator.validate(row(values))).isEmpty();
    }

    @Test
    @DisplayName("optional columns may be blank or absent")
    void optionalBlank() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Adresse", "Vej 1");
        values.put("Postnummer", "8000");
        values.put("PostDistrikt", "Aarhus C");
        values.put("ModtageranlægID", "1013");
        values.put("Dato", "");
        values.put("LastVægt", null);

        assertThat(validator.validate(row(values))).isEmpty();
    }

    @Nested
    @DisplayName("mandatory fields")
    class Mandatory {

        @ParameterizedTest
        @ValueSource(strings = {"Adresse", "Postnummer", "PostDistrikt", "ModtageranlægID"})
        @DisplayName("a blank mandatory field is reported on its own")
        void blankMandatory(String column) {
            List<FieldError> errors = validator.validate(templateWith(column, "  "));

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.getField()).isEqualTo(column);
                assertThat(e.getCode()).isEqualTo(ErrorCode.REQUIRED_FIELD_MISSING);
                assertThat(e.getRowIndex()).isEqualTo(7);
            });
        }

        @Test
        @DisplayName("every missing field is reported, whatever else is wrong")
        void allMissing() {
            Map<String, Object> values = templateRow();
            values.put("Adresse", null);
            values.put("PostDistrikt", "");
            values.put("KøretøjsType", "Cykel");

            List<FieldError> errors = validator.validate(row(values));

            assertThat(errors).extracting(FieldError::getField, FieldError::getCode).containsExactly(
                    tuple("Adresse", ErrorCode.REQUIRED_FIELD_MISSING),
                    tuple("PostDistrikt", ErrorCode.REQUIRED_FIELD_MISSING),
                    tuple("KøretøjsType", ErrorCode.INVALID_ENUM_VALUE));
        }
    }

    @Nested
    @DisplayName("Postnummer")
    class PostalCode {

        @ParameterizedTest
        @ValueSource(strings = {"999", "10000", "0", "-1000", "10000000000", "-99999999999"})
        @DisplayName("outside 1000-9999 is out of range, however large")
        void outOfRange(String value) {
            assertThat(validator.validate(templateWith("Postnummer", value)))
                    .extracting(FieldError::getCode)
                    .containsExactly(ErrorCode.POSTAL_CODE_OUT_OF_RANGE);
        }

        @ParameterizedTest
        @ValueSource(strings = {"1000", "9999", "8000"})
        @DisplayName("the range bounds are inclusive")
        void inRange(String value) {
            assertThat(validator.validate(templateWith("Postnummer", value))).isEmpty();
        }

        @Test
        @DisplayName("a numeric cell beyond int range is out of range")
        void hugeNumericCell() {
            assertThat(validator.validate(templateWith("Postnummer", 1.0e10)))
                    .extracting(FieldError::getCode)
                    .containsExactly(ErrorCode.POSTAL_CODE_OUT_OF_RANGE);
        }

        @Test
        @DisplayName("a fraction is an invalid type")
        void fraction() {
            assertThat(validator.validate(templateWith("Postnummer", "8000.5")))
                    .extracting(FieldError::getCode)
                    .containsExactly(ErrorCode.INVALID_TYPE);
        }

        @Test
        @DisplayName("text is an invalid type")
        void notANumber() {
            assertThat(validator.validate(templateWith("Postnummer", "DK-1000")))
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_TYPE);
                        assertThat(e.getValue()).isEqualTo("DK-1000");
                    });
        }
    }

    @Nested
    @DisplayName("ModtageranlægID")
    class FacilityId {

        @ParameterizedTest
        @ValueSource(strings = {"1000", "1062", "9999", "10000000000", "99999999999", "-1"})
        @DisplayName("a whole number outside the directory is unknown, however large")
        void unknown(String value) {
            assertThat(validator.validate(templateWith("ModtageranlægID", value)))
                    .extracting(FieldError::getCode)
                    .containsExactly(ErrorCode.UNKNOWN_FACILITY_ID);
        }

        @ParameterizedTest
        @ValueSource(strings = {"1061", "1013", "1327", "2191", "1901"})
        @DisplayName("every directory entry is accepted")
        void known(String value) {
            assertThat(validator.validate(templateWith("ModtageranlægID", value))).isEmpty();
        }

        @Test
        @DisplayName("empty, non-numeric and unknown are told apart")
        void disambiguation() {
            assertThat(validator.validate(templateWith("ModtageranlægID", "")))
                    .extracting(FieldError::getCode).containsExactly(ErrorCode.REQUIRED_FIELD_MISSING);
            assertThat(validator.validate(templateWith("ModtageranlægID", "Birkesig")))
                    .extracting(FieldError::getCode).containsExactly(ErrorCode.INVALID_TYPE);
            assertThat(validator.validate(templateWith("ModtageranlægID", "4242")))
                    .extracting(FieldError::getCode).containsExactly(ErrorCode.UNKNOWN_FACILITY_ID);
        }

        @Test
        @DisplayName("a substituted directory changes what is known")
        void customDirectory() {
            RowValidator custom = new RowValidator(SchemaDefinition.standard(),
                    new ReferenceDirectory("test", List.of(new Facility(4242, "Testanlæg", "Vej 2, 8000 Aarhus C"))));

            assertThat(custom.validate(templateWith("ModtageranlægID", "4242"))).isEmpty();
            assertThat(custom.validate(templateWith("ModtageranlægID", "1061")))
                    .extracting(FieldError::getCode).containsExactly(ErrorCode.UNKNOWN_FACILITY_ID);
        }
    }

    @Nested
    @DisplayName("optional typed fields")
    class OptionalFields {

        @ParameterizedTest
        @ValueSource(strings = {"26/08/2024", "+12024-01-01", "-2024-08-26", "12024-08-26", "2024-8-26", "2024-08-26T10:00"})
        @DisplayName("dates outside YYYY-MM-DD are rejected")
        void badDate(String value) {
            assertThat(validator.validate(templateWith("Dato", value)))
                    .extracting(FieldError::getCode).containsExactly(ErrorCode.INVALID_DATE_FORMAT);
        }

        @Test
        @DisplayName("enum values are matched case-insensitively")
        void enumCase() {
            Map<String, Object> values = templateRow();
            values.put("KøretøjsType", "LASTBIL");
            values.put("Brændstoftype", "Diesel");

            assertThat(validator.validate(row(values))).isEmpty();
        }

        @Test
        @DisplayName("unknown enum values list the allowed ones")
        void badEnum() {
            assertThat(validator.validate(templateWith("Brændstoftype", "brint")))
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_ENUM_VALUE);
                        assertThat(e.getMessage()).contains("diesel", "benzin", "el", "hybrid");
                    });
        }

        @ParameterizedTest
        @ValueSource(strings = {"tung", "0", "-5"})
        @DisplayName("weight must be a positive number")
        void badWeight(String value) {
            assertThat(validator.validate(templateWith("LastVægt", value)))
                    .extracting(FieldError::getCode).containsExactly(ErrorCode.INVALID_TYPE);
        }
    }

    @Test
    @DisplayName("several errors in one row come back together in column order")
    void multipleErrors() {
        Map<String, Object> values = templateRow();
        values.put("Brændstoftype", "brint");
        values.put("Postnummer", "500");
        values.put("ModtageranlægID", "7");
        values.put("Dato", "i går");

        List<FieldError> errors = validator.validate(row(values));

        assertThat(errors).extracting(FieldError::getField)
                .containsExactly("Postnummer", "ModtageranlægID", "Dato", "Brændstoftype");
        assertThat(errors.get(0).toString()).startsWith("Række 7, felt 'Postnummer'");
    }

    @Nested
    @DisplayName("warnings")
    class Warnings {

        @Test
        @DisplayName("the template row and full header raise none")
        void templateClean() {
            assertThat(validator.warnings(row(templateRow()))).isEmpty();
            assertThat(validator.headerWarnings(List.copyOf(templateRow().keySet()))).isEmpty();
        }

        @Test
        @DisplayName("a very heavy load is flagged but stays valid")
        void heavyLoad() {
            RawRow heavy = templateWith("LastVægt", "62000");

            assertThat(validator.validate(heavy)).isEmpty();
            assertThat(validator.warnings(heavy)).singleElement().satisfies(w -> {
                assertThat(w.getField()).isEqualTo("LastVægt");
                assertThat(w.getRowIndex()).isEqualTo(7);
                assertThat(w.getMessage()).isEqualTo("Meget høj vægt: 62000 kg");
                assertThat(w.getSuggestion()).isEqualTo("Kontroller at vægten er korrekt");
            });
        }

        @Test
        @DisplayName("exactly 50000 kg is not flagged")
        void weightBoundary() {
            assertThat(validator.warnings(templateWith("LastVægt", "50000"))).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"Vej", "Nørregade", "12345 67", "x1"})
        @DisplayName("addresses without street and number look implausible")
        void implausibleAddress(String address) {
            assertThat(validator.warnings(templateWith("Adresse", address)))
                    .extracting(FieldWarning::getField).containsExactly("Adresse");
        }

        @Test
        @DisplayName("address plausibility checks length and content")
        void addressRules() {
            assertThat(RowValidator.isPlausibleAddress("Åvej 3")).isTrue();
            assertThat(RowValidator.isPlausibleAddress("Vej 1")).isTrue();
            assertThat(RowValidator.isPlausibleAddress("Ve 1")).isFalse();
            assertThat(RowValidator.isPlausibleAddress("Vej 1" + "a".repeat(200))).isFalse();
        }

        @Test
        @DisplayName("a row with fewer filled cells than mandatory columns is flagged")
        void sparseRow() {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("Adresse", "Nørregade 10");
            values.put("Postnummer", "1000");
            values.put("PostDistrikt", "");
            values.put("ModtageranlægID", null);

            assertThat(validator.warnings(row(values))).singleElement()
                    .satisfies(w -> assertThat(w.getMessage()).isEqualTo("Række har kun 2 udfyldte felter"));
        }

        @Test
        @DisplayName("missing useful optional columns are named once for the file")
        void missingUsefulColumns() {
            List<FieldWarning> warnings = validator.headerWarnings(
                    List.of("Adresse", "Postnummer", "PostDistrikt", "ModtageranlægID", "Navn", "Dato"));

            assertThat(warnings).singleElement().satisfies(w -> {
                assertThat(w.getRowIndex()).isNull();
                assertThat(w.getMessage()).isEqualTo("Manglende nyttige kolonner: Brændstoftype, LastVægt, KøretøjsType");
                assertThat(w.toString()).endsWith("(Forslag: Tilføj disse kolonner for bedre rapportering)");
            });
        }

        @Test
        @DisplayName("unknown columns are flagged by name")
        void unknownColumn() {
            List<String> header = new ArrayList<>(templateRow().keySet());
            header.add("Kommentar");

            assertThat(validator.headerWarnings(header)).singleElement().satisfies(w -> {
                assertThat(w.getField()).isEqualTo("Kommentar");
                assertThat(w.getMessage()).isEqualTo("Ukendt kolonne 'Kommentar' fundet");
            });
        }
    }

    @Nested
    @DisplayName("header check")
    class Header {

        @Test
        @DisplayName("names every missing mandatory column")
        void missingColumns() {
            assertThatThrownBy(() -> validator.checkHeader(List.of("Adresse", "Postnummer", "PostDistrikt", "Navn")))
                    .isInstanceOf(MissingColumnsException.class)
                    .satisfies(e -> {
                        MissingColumnsException ex = (MissingColumnsException) e;
                        assertThat(ex.getCode()).isEqualTo(FatalErrorCode.MISSING_COLUMNS);
                        assertThat(ex.getMissingColumns()).containsExactly("ModtageranlægID");
                    });
        }

        @Test
        @DisplayName("extra columns do not fail the header")
        void extraColumns() {
            validator.checkHeader(List.of("Kommentar", "Adresse", "Postnummer", "PostDistrikt", "ModtageranlægID"));
        }
    }
}
