package com.example.licensescanner.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class DateOfBirthParserTest {

    @Test
    void parsesPrintedAndBarcodeFormats() {
        LocalDate expected = LocalDate.of(1990, 1, 15);

        assertThat(DateOfBirthParser.parse("01/15/1990")).contains(expected);
        assertThat(DateOfBirthParser.parse("1/15/1990")).contains(expected);
        assertThat(DateOfBirthParser.parse("01-15-1990")).contains(expected);
        assertThat(DateOfBirthParser.parse("1990-01-15")).contains(expected);
        assertThat(DateOfBirthParser.parse("1990/01/15")).contains(expected);
        assertThat(DateOfBirthParser.parse("01151990")).contains(expected);
    }

    @Test
    void findsDateInsideSurroundingText() {
        assertThat(DateOfBirthParser.parse("07/04/1985 SEX M")).contains(LocalDate.of(1985, 7, 4));
    }

    @Test
    void rejectsImpossibleOrImplausibleDates() {
        assertThat(DateOfBirthParser.parse("02/30/1990")).isEmpty();
        assertThat(DateOfBirthParser.parse("13/01/1990")).isEmpty();
        assertThat(DateOfBirthParser.parse("01/15/1850")).isEmpty();
        assertThat(DateOfBirthParser.parse("UNKNOWN")).isEmpty();
        assertThat(DateOfBirthParser.parse(null)).isEmpty();
    }

    @Test
    void detectsCompactDates() {
        assertThat(DateOfBirthParser.isCompactDate("01151990")).isTrue();
        assertThat(DateOfBirthParser.isCompactDate("12345678")).isFalse();
        assertThat(DateOfBirthParser.isCompactDate("0115199")).isFalse();
        assertThat(DateOfBirthParser.isCompactDate("A1151990")).isFalse();
    }
}
