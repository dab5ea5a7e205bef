package com.walletledger.records;

import com.walletledger.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for record construction and amount corrections.
 */
class LedgerRecordTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 10);

    @Test
    void testRateDerivedFromAmounts() {
        LedgerRecord record = LedgerRecord.builder()
            .type(RecordType.EXPENSE)
            .date(DATE)
            .walletId(1)
            .amountOriginal(100)
            .currency("usd")
            .amountKzt(50000)
            .category("Food")
            .build();

        assertEquals("USD", record.getCurrency());
        assertEquals(500.0, record.getRateAtOperation(), 1e-9);
        assertEquals(-50000.0, record.signedAmountKzt(), 1e-9);
        assertFalse(record.isTransferLeg());
    }

    @Test
    void testBaseCurrencyRateIsOne() {
        LedgerRecord record = LedgerRecord.builder()
            .type(RecordType.INCOME)
            .date(DATE)
            .walletId(1)
            .amountOriginal(1200)
            .currency("KZT")
            .amountKzt(1200)
            .category("Salary")
            .build();

        assertEquals(1.0, record.getRateAtOperation());
        assertTrue(record.isIncome());
        assertEquals(1200.0, record.signedAmountKzt());
    }

    @Test
    void testWithAmountKztRoundsAndRederivesRate() {
        LedgerRecord record = LedgerRecord.builder()
            .type(RecordType.EXPENSE)
            .id(7)
            .date(DATE)
            .walletId(1)
            .amountOriginal(100)
            .currency("USD")
            .amountKzt(50000)
            .category("Travel")
            .build();

        LedgerRecord updated = record.withAmountKzt(51001.987);

        assertEquals(7, updated.getId());
        assertEquals(51001.99, updated.getAmountKzt(), 1e-9);
        assertEquals(100.0, updated.getAmountOriginal());
        assertEquals(510.0199, updated.getRateAtOperation(), 1e-9);
        assertEquals(RecordType.EXPENSE, updated.getType());
    }

    @Test
    void testWithAmountKztKeepsBaseAmountsEqual() {
        LedgerRecord record = LedgerRecord.builder()
            .type(RecordType.EXPENSE)
            .date(DATE)
            .walletId(1)
            .amountOriginal(300)
            .currency("KZT")
            .amountKzt(300)
            .build();

        LedgerRecord updated = record.withAmountKzt(450.004);

        assertEquals(450.0, updated.getAmountKzt());
        assertEquals(450.0, updated.getAmountOriginal());
        assertEquals(1.0, updated.getRateAtOperation());
    }

    @Test
    void testWithAmountKztRejectedForZeroOriginal() {
        LedgerRecord record = LedgerRecord.builder()
            .type(RecordType.EXPENSE)
            .date(DATE)
            .walletId(1)
            .amountOriginal(0)
            .currency("USD")
            .amountKzt(0)
            .build();

        assertEquals(1.0, record.getRateAtOperation());
        assertThrows(ValidationException.class, () -> record.withAmountKzt(10));
    }

    @Test
    void testDefaultsAndValidation() {
        LedgerRecord record = LedgerRecord.builder()
            .type(RecordType.EXPENSE)
            .date(DATE)
            .walletId(2)
            .amountOriginal(5)
            .currency("KZT")
            .amountKzt(-5)
            .category("  ")
            .build();
        assertEquals(LedgerRecord.DEFAULT_CATEGORY, record.getCategory());
        assertEquals(5.0, record.getAmountKzt());
        assertEquals("", record.getDescription());

        assertThrows(ValidationException.class, () -> LedgerRecord.builder()
            .type(RecordType.INCOME).walletId(1).amountOriginal(1).currency("KZT").amountKzt(1).build());
        assertThrows(ValidationException.class, () -> LedgerRecord.builder()
            .type(RecordType.INCOME).date(DATE).walletId(1).amountOriginal(-1).currency("KZT").amountKzt(1)
            .build());
        assertThrows(ValidationException.class, () -> LedgerRecord.builder()
            .type(RecordType.INCOME).date(DATE).walletId(0).amountOriginal(1).currency("KZT").amountKzt(1)
            .build());
    }

    @Test
    void testMandatoryTemplateApplied() {
        LedgerRecord template = LedgerRecord.builder()
            .type(RecordType.MANDATORY_EXPENSE)
            .id(3)
            .walletId(1)
            .amountOriginal(20)
            .currency("USD")
            .amountKzt(10000)
            .category("Rent")
            .period(MandatoryPeriod.MONTHLY)
            .build();
        assertNull(template.getDate());

        MandatoryExpenseRecord applied = ((MandatoryExpenseRecord) template).applyTo(DATE, 2);

        assertEquals(0, applied.getId());
        assertEquals(DATE, applied.getDate());
        assertEquals(2, applied.getWalletId());
        assertEquals(MandatoryPeriod.MONTHLY, applied.getPeriod());
        assertEquals(500.0, applied.getRateAtOperation(), 1e-9);
    }

    @Test
    void testTypeAndPeriodCodes() {
        assertEquals(RecordType.MANDATORY_EXPENSE, RecordType.fromCode("mandatory_expense"));
        assertEquals(MandatoryPeriod.YEARLY, MandatoryPeriod.fromCode("Yearly"));
        assertThrows(ValidationException.class, () -> RecordType.fromCode("refund"));
        assertThrows(ValidationException.class, () -> MandatoryPeriod.fromCode("hourly"));
    }
}
