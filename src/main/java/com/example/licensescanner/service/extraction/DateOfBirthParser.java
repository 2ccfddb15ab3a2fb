package com.example.licensescanner.service.extraction;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict parser for the date formats printed on US licences and encoded in AAMVA barcodes.
 */
public final class DateOfBirthParser {

    private static final int MIN_YEAR = 1900;

    private static final Pattern DATE_TOKEN = Pattern.compile(
            "(?<!\\d)(\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{4}|\\d{4}[/\\-]\\d{1,2}[/\\-]\\d{1,2}|\\d{8})(?!\\d)");

    private static final List<DateTimeFormatter> FORMATS = List.of(
            strict("M/d/uuuu"),
            strict("M-d-uuuu"),
            strict("uuuu-M-d"),
            strict("uuuu/M/d"),
            strict("MMdduuuu"));

    private DateOfBirthParser() {
    }

    /**
     * Parse the first date-shaped token of {@code value}.
     *
     * @return the date, or empty when no token parses to a real calendar date from 1900 onwards
     */
    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = DATE_TOKEN.matcher(value);
        while (matcher.find()) {
            Optional<LocalDate> parsed = parseToken(matcher.group(1));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    /**
     * Whether {@code value} is eight digits that read as an {@code MMddyyyy} date. Such values are
     * usually dates of birth or expiry dates, not document numbers.
     */
    public static boolean isCompactDate(String value) {
        return value != null && value.length() == 8 && value.chars().allMatch(Character::isDigit)
                && parseToken(value).filter(date -> date.getYear() <= 2099).isPresent();
    }

    private static Optional<LocalDate> parseToken(String token) {
        return FORMATS.stream()
                .map(format -> tryParse(token, format))
                .flatMap(Optional::stream)
                .filter(date -> date.getYear() >= MIN_YEAR)
                .findFirst();
    }

    private static Optional<LocalDate> tryParse(String token, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(token, format));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
