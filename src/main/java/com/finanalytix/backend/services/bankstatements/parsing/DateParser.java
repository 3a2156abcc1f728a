package com.finanalytix.backend.services.bankstatements.parsing;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Reads dates written in the layouts Mexican banks export.
 *
 * <p>Layouts are tried in order and the first one that reads the whole value wins.
 * Day-first layouts come before month-first ones, so "03/04/2024" is the 3rd of April.
 */
public final class DateParser {

    private static final List<DateTimeFormatter> STATEMENT_FORMATS = List.of(
            strict("d/M/uuuu"),
            strict("d-M-uuuu"),
            strict("uuuu/M/d"),
            strict("uuuu-M-d"),
            twoDigitYear("/"),
            strict("M/d/uuuu"),
            DateTimeFormatter.BASIC_ISO_DATE.withResolverStyle(ResolverStyle.STRICT)
    );

    // Layouts accepted for date tokens found inside free PDF text.
    private static final List<DateTimeFormatter> TEXT_TOKEN_FORMATS = List.of(
            strict("d/M/uuuu"),
            strict("d-M-uuuu"),
            strict("M/d/uuuu"),
            twoDigitYear("/")
    );

    private DateParser() {
    }

    /**
     * Returns the calendar date, or {@code null} when the value is empty or matches no layout.
     */
    public static LocalDate parse(Object value) {
        if (value == null) return null;

        if (value instanceof LocalDate date) return date;
        if (value instanceof LocalDateTime dateTime) return dateTime.toLocalDate();
        if (value instanceof ZonedDateTime zoned) return zoned.toLocalDate();
        if (value instanceof OffsetDateTime offset) return offset.toLocalDate();
        if (value instanceof Instant instant) return instant.atZone(ZoneId.systemDefault()).toLocalDate();
        if (value instanceof Date legacy) {
            return legacy.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        }
        if (value instanceof Number number) {
            // 20240301 read from a numeric cell
            if (number.doubleValue() == 0d || number.doubleValue() != Math.rint(number.doubleValue())) return null;
            return firstMatch(Long.toString(number.longValue()), STATEMENT_FORMATS);
        }

        return firstMatch(value.toString(), STATEMENT_FORMATS);
    }

    /**
     * Reads a date token picked out of free PDF text (e.g. "5/3/2024", "05-03-2024", "05/03/24").
     */
    public static LocalDate parseTextToken(String token) {
        return firstMatch(token, TEXT_TOKEN_FORMATS);
    }

    private static LocalDate firstMatch(String raw, List<DateTimeFormatter> formats) {
        if (raw == null) return null;
        String text = raw.trim();
        if (text.isEmpty()) return null;

        return formats.stream()
                .map(format -> tryParse(text, format))
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(null);
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(text, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    // dd/MM/yy: 69-99 map to the 1900s and 00-68 to the 2000s.
    private static DateTimeFormatter twoDigitYear(String separator) {
        return new DateTimeFormatterBuilder()
                .appendValue(ChronoField.DAY_OF_MONTH)
                .appendLiteral(separator)
                .appendValue(ChronoField.MONTH_OF_YEAR)
                .appendLiteral(separator)
                .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
