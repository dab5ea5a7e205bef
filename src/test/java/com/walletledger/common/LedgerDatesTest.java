package com.walletledger.common;

import com.walletledger.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class LedgerDatesTest {

    @Test
    void testParseValidDate() {
        assertEquals(LocalDate.of(2024, 2, 29), LedgerDates.parse("2024-02-29"));
        assertEquals(LocalDate.of(2025, 1, 5), LedgerDates.parse(" 2025-01-05 "));
    }

    @Test
    void testRejectsCalendarInvalidDates() {
        assertThrows(ValidationException.class, () -> LedgerDates.parse("2025-13-01"));
        assertThrows(ValidationException.class, () -> LedgerDates.parse("2023-02-29"));
        assertThrows(ValidationException.class, () -> LedgerDates.parse("2025-04-31"));
    }

    @Test
    void testRejectsWrongShape() {
        assertThrows(ValidationException.class, () -> LedgerDates.parse("25-01-01"));
        assertThrows(ValidationException.class, () -> LedgerDates.parse("2025/01/01"));
        assertThrows(ValidationException.class, () -> LedgerDates.parse("2025-1-1"));
        assertThrows(ValidationException.class, () -> LedgerDates.parse(""));
        assertThrows(ValidationException.class, () -> LedgerDates.parse(null));
    }

    @Test
    void testFutureDateRejected() {
        LocalDate today = LocalDate.of(2025, 6, 1);
        LedgerDates.ensureNotFuture(today, today);
        ValidationException e = assertThrows(ValidationException.class,
            () -> LedgerDates.ensureNotFuture(today.plusDays(1), today));
        assertTrue(e.getMessage().contains("2025-06-02"));
    }

    @Test
    void testCurrencyCodes() {
        assertEquals("USD", CurrencyCodes.normalize(" usd "));
        assertFalse(CurrencyCodes.isValid("US"));
        assertFalse(CurrencyCodes.isValid("US1"));
        assertThrows(ValidationException.class, () -> CurrencyCodes.normalize("DOLLAR"));
    }

    @Test
    void testAmountsRounding() {
        assertEquals(51001.99, Amounts.round2(51001.987));
        assertEquals(0.13, Amounts.round2(0.125));
        assertTrue(Amounts.equal(0.1 + 0.2, 0.3));
        assertTrue(Amounts.isZero(0.000001));
        assertFalse(Amounts.isZero(0.01));
    }
}
