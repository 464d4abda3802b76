package com.jordtransport.manifest.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ValueParsers")
class ValueParsersTest {

    @Test
    @DisplayName("whole numbers accept text and integral numeric cells")
    void wholeNumbers() {
        assertThat(ValueParsers.parseWholeNumber("1000")).contains(1000);
        assertThat(ValueParsers.parseWholeNumber(" 8000 ")).contains(8000);
        assertThat(ValueParsers.parseWholeNumber("1000.0")).contains(1000);
        assertThat(ValueParsers.parseWholeNumber(1061.0)).contains(1061);
    }

    @Test
    @DisplayName("whole numbers refuse fractions, words and blanks")
    void notWholeNumbers() {
        assertThat(ValueParsers.parseWholeNumber("1000.5")).isEmpty();
        assertThat(ValueParsers.parseWholeNumber(1000.5)).isEmpty();
        assertThat(ValueParsers.parseWholeNumber("abc")).isEmpty();
        assertThat(ValueParsers.parseWholeNumber("")).isEmpty();
        assertThat(ValueParsers.parseWholeNumber(null)).isEmpty();
        assertThat(ValueParsers.parseWholeNumber("99999999999")).isEmpty();
    }

    @Test
    @DisplayName("integers keep their magnitude so range checks can see it")
    void integersOfAnySize() {
        assertThat(ValueParsers.parseInteger("10000000000")).hasValueSatisfying(
                d -> assertThat(d).isEqualByComparingTo(new BigDecimal("10000000000")));
        assertThat(ValueParsers.parseInteger(1.0e10)).isPresent();
        assertThat(ValueParsers.parseInteger("1000.0")).hasValueSatisfying(
                d -> assertThat(d).isEqualByComparingTo(BigDecimal.valueOf(1000)));
        assertThat(ValueParsers.parseInteger("0")).isPresent();
        assertThat(ValueParsers.parseInteger("10000000000.5")).isEmpty();
        assertThat(ValueParsers.parseInteger("1e999999999")).isPresent();
        assertThat(ValueParsers.parseWholeNumber("1e999999999")).isEmpty();
    }

    @Test
    @DisplayName("decimals accept a comma separator")
    void decimals() {
        assertThat(ValueParsers.parseDecimal("2500")).contains(2500.0);
        assertThat(ValueParsers.parseDecimal("2,5")).contains(2.5);
        assertThat(ValueParsers.parseDecimal("2.5")).contains(2.5);
        assertThat(ValueParsers.parseDecimal(12.75)).contains(12.75);
        assertThat(ValueParsers.parseDecimal("1.000,5")).isEmpty();
        assertThat(ValueParsers.parseDecimal("tung")).isEmpty();
        assertThat(ValueParsers.parseDecimal(Double.NaN)).isEmpty();
    }

    @Test
    @DisplayName("dates must be real ISO calendar dates")
    void dates() {
        assertThat(ValueParsers.parseIsoDate("2024-08-26")).contains(LocalDate.of(2024, 8, 26));
        assertThat(ValueParsers.parseIsoDate("2024-02-30")).isEmpty();
        assertThat(ValueParsers.parseIsoDate("26-08-2024")).isEmpty();
        assertThat(ValueParsers.parseIsoDate("2024/08/26")).isEmpty();
        assertThat(ValueParsers.parseIsoDate("+12024-01-01")).isEmpty();
        assertThat(ValueParsers.parseIsoDate("+2024-01-01")).isEmpty();
        assertThat(ValueParsers.parseIsoDate("2024-8-26")).isEmpty();
        assertThat(ValueParsers.parseIsoDate(null)).isEmpty();
    }
}
