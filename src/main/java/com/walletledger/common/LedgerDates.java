package com.walletledger.common;

import com.walletledger.common.exception.ValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Strict parsing of ledger dates.
 * Only calendar-valid {@code YYYY-MM-DD} values with a four digit year are accepted.
 */
public final class LedgerDates {

    private static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private LedgerDates() {
    }

    public static LocalDate parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Date is required");
        }
        String trimmed = value.trim();
        if (!trimmed.matches("\\d{4}-\\d{2}-\\d{2}")) {
            throw new ValidationException("Invalid date format: " + value + " (expected YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(trimmed, FORMAT);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid calendar date: " + value, e);
        }
    }

    public static String format(LocalDate date) {
        return date == null ? "" : date.format(FORMAT);
    }

    public static void ensureNotFuture(LocalDate date) {
        ensureNotFuture(date, LocalDate.now());
    }

    public static void ensureNotFuture(LocalDate date, LocalDate today) {
        if (date.isAfter(today)) {
            throw new ValidationException("Date cannot be in the future: " + format(date));
        }
    }
}
