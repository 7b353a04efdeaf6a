package com.attendance.tracker.common;

import com.attendance.tracker.common.exception.ValidationException;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * The one place where external date text becomes a {@link LocalDate} and back.
 * All dates crossing the API use {@code DD-MM-YYYY}.
 */
public final class DateFormats {

    public static final String PATTERN = "dd-MM-yyyy";

    /** dd-MM-uuuu with a strict resolver, so 31-02-2025 is rejected instead of clamped. */
    public static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("dd-MM-uuuu", Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    /** 15-Jul-2025 */
    public static final DateTimeFormatter LONG = DateTimeFormatter.ofPattern("dd-MMM-uuuu", Locale.ENGLISH);

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("MM-uuuu", Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    private DateFormats() {
    }

    public static LocalDate parse(String text) {
        return parse(text, "date");
    }

    /**
     * @param label used in the error message, e.g. "start date"
     */
    public static LocalDate parse(String text, String label) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Missing " + label + ". Use DD-MM-YYYY");
        }
        try {
            return LocalDate.parse(text.trim(), DAY);
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Invalid " + label + " format. Use DD-MM-YYYY", ex);
        }
    }

    public static YearMonth parseMonth(String text) {
        try {
            return YearMonth.parse(text.trim(), MONTH);
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Invalid month format. Use MM-YYYY", ex);
        }
    }

    public static String format(LocalDate date) {
        return date == null ? null : DAY.format(date);
    }

    public static String formatLong(LocalDate date) {
        return date == null ? null : LONG.format(date);
    }
}
