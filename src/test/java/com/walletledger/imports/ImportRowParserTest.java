package com.walletledger.imports;

import com.walletledger.currency.StaticCurrencyRateProvider;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.records.MandatoryPeriod;
import com.walletledger.records.RecordType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for row parsing under each import policy.
 */
class ImportRowParserTest {

    private final ImportRowParser parser =
        new ImportRowParser(new StaticCurrencyRateProvider("KZT", Map.of("USD", 500.0, "EUR", 590.0)));

    private static Map<String, String> row(String... keyValues) {
        Map<String, String> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put(keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static Map<String, String> fullBackupRow() {
        return row("date", "2025-02-01", "type", "expense", "wallet_id", "1", "category", "Food",
            "amount_original", "10", "currency", "usd", "rate_at_operation", "510", "amount_kzt", "5100");
    }

    @Test
    void testFullBackupTrustsStoredAmount() {
        ParsedRow parsed = parser.parse(fullBackupRow(), "row 2", ImportPolicy.FULL_BACKUP, false);

        assertFalse(parsed.isError());
        LedgerRecord record = parsed.getRecord();
        assertEquals(RecordType.EXPENSE, record.getType());
        assertEquals("USD", record.getCurrency());
        assertEquals(5100.0, record.getAmountKzt());
        assertEquals(510.0, record.getRateAtOperation(), 1e-9);
    }

    @Test
    void testCurrentRateRecomputesAmount() {
        Map<String, String> input = fullBackupRow();
        input.remove("amount_kzt");
        input.remove("rate_at_operation");

        LedgerRecord record = parser.parse(input, "row 2", ImportPolicy.CURRENT_RATE, false).getRecord();

        assertEquals(5000.0, record.getAmountKzt());
        assertEquals(500.0, record.getRateAtOperation(), 1e-9);
    }

    @Test
    void testCurrentRateWithoutProvider() {
        ParsedRow parsed = new ImportRowParser(null)
            .parse(fullBackupRow(), "row 2", ImportPolicy.CURRENT_RATE, false);

        assertEquals("row 2: current-rate policy requires currency service", parsed.getError());
    }

    @Test
    void testCurrentRateUnknownCurrency() {
        Map<String, String> input = fullBackupRow();
        input.put("currency", "GBP");

        ParsedRow parsed = parser.parse(input, "row 4", ImportPolicy.CURRENT_RATE, false);

        assertTrue(parsed.getError().startsWith("row 4: failed to get current rate for GBP"));
    }

    @Test
    void testLegacyAmountInBaseCurrency() {
        LedgerRecord record = parser.parse(
            row("Date", "2024-12-31", "Type", "income", "Category", "Salary", "Amount", "(250.5)"),
            "row 2", ImportPolicy.LEGACY, false).getRecord();

        assertEquals("KZT", record.getCurrency());
        assertEquals(250.5, record.getAmountOriginal());
        assertEquals(250.5, record.getAmountKzt());
        assertEquals(1.0, record.getRateAtOperation());
    }

    @Test
    void testRejectedRows() {
        Map<String, String> badCurrency = fullBackupRow();
        badCurrency.put("currency", "US");
        assertEquals("row 2: invalid currency 'US'",
            parser.parse(badCurrency, "row 2", ImportPolicy.FULL_BACKUP, false).getError());

        Map<String, String> badDate = fullBackupRow();
        badDate.put("date", "2025-13-01");
        assertTrue(parser.parse(badDate, "row 3", ImportPolicy.FULL_BACKUP, false).getError()
            .startsWith("row 3: invalid date '2025-13-01'"));

        Map<String, String> missingCategory = fullBackupRow();
        missingCategory.remove("category");
        assertEquals("row 4: missing required field 'category'",
            parser.parse(missingCategory, "row 4", ImportPolicy.FULL_BACKUP, false).getError());

        Map<String, String> badType = fullBackupRow();
        badType.put("type", "refund");
        assertEquals("row 5: unsupported type 'refund'",
            parser.parse(badType, "row 5", ImportPolicy.FULL_BACKUP, false).getError());

        Map<String, String> negative = fullBackupRow();
        negative.put("amount_original", "-3");
        assertEquals("row 6: amount_original must be >= 0",
            parser.parse(negative, "row 6", ImportPolicy.FULL_BACKUP, false).getError());

        Map<String, String> missingRate = fullBackupRow();
        missingRate.remove("rate_at_operation");
        assertEquals("row 7: missing required field 'rate_at_operation'",
            parser.parse(missingRate, "row 7", ImportPolicy.FULL_BACKUP, false).getError());

        assertEquals("row 8: invalid amount", parser.parse(
            row("date", "2024-01-01", "type", "income", "category", "X", "amount", "abc"),
            "row 8", ImportPolicy.LEGACY, false).getError());
    }

    @Test
    void testInitialBalanceRow() {
        ParsedRow parsed = parser.parse(row("type", "initial_balance", "amount_original", "1200"),
            "row 2", ImportPolicy.FULL_BACKUP, false);

        assertTrue(parsed.isInitialBalance());
        assertEquals(1200.0, parsed.getInitialBalance());
    }

    @Test
    void testMandatoryRowAliasAndPeriod() {
        Map<String, String> input = fullBackupRow();
        input.put("type", "mandatory");
        input.put("period", "Weekly");

        LedgerRecord record = parser.parse(input, "row 2", ImportPolicy.FULL_BACKUP, false).getRecord();

        assertInstanceOf(MandatoryExpenseRecord.class, record);
        assertEquals(MandatoryPeriod.WEEKLY, ((MandatoryExpenseRecord) record).getPeriod());

        input.put("period", "hourly");
        assertEquals("row 2: invalid mandatory period 'hourly'",
            parser.parse(input, "row 2", ImportPolicy.FULL_BACKUP, false).getError());
    }

    @Test
    void testMandatoryOnlyRowsNeedNoDate() {
        Map<String, String> input = row("category", "Rent", "amount_original", "100", "currency", "KZT",
            "rate_at_operation", "1", "amount_kzt", "100", "period", "monthly");

        LedgerRecord record = parser.parse(input, "row 2", ImportPolicy.FULL_BACKUP, true).getRecord();

        assertNull(record.getDate());
        assertEquals(RecordType.MANDATORY_EXPENSE, record.getType());
    }

    @Test
    void testTransferRow() {
        Map<String, String> input = row("date", "2025-02-01", "type", "transfer", "from_wallet_id", "1",
            "to_wallet_id", "2", "amount_original", "10", "currency", "USD", "rate_at_operation", "500",
            "amount_kzt", "5000", "transfer_id", "7");

        ParsedTransfer parsed = parser.parseTransfer(input, "row 2", ImportPolicy.FULL_BACKUP, 1, Set.of(1L, 2L));

        assertFalse(parsed.isError());
        assertEquals(7, parsed.getTransfer().getId());
        assertEquals(2, parsed.getLegs().size());
        LedgerRecord expense = parsed.getLegs().get(0);
        LedgerRecord income = parsed.getLegs().get(1);
        assertEquals(RecordType.EXPENSE, expense.getType());
        assertEquals(1, expense.getWalletId());
        assertEquals(RecordType.INCOME, income.getType());
        assertEquals(2, income.getWalletId());
        assertEquals(7L, income.getTransferId());
    }

    @Test
    void testTransferRowErrors() {
        Map<String, String> input = row("date", "2025-02-01", "type", "transfer", "from_wallet_id", "1",
            "to_wallet_id", "1", "amount_original", "10", "currency", "KZT", "rate_at_operation", "1",
            "amount_kzt", "10");
        assertEquals("row 2: transfer wallets must be different",
            parser.parseTransfer(input, "row 2", ImportPolicy.FULL_BACKUP, 1, null).getError());

        input.put("to_wallet_id", "");
        assertEquals("row 2: invalid transfer wallets (from_wallet_id/to_wallet_id)",
            parser.parseTransfer(input, "row 2", ImportPolicy.FULL_BACKUP, 1, null).getError());

        input.put("to_wallet_id", "9");
        assertEquals("row 2: wallet not found (9)",
            parser.parseTransfer(input, "row 2", ImportPolicy.FULL_BACKUP, 1, Set.of(1L)).getError());
    }

    @Test
    void testTransferRowFractionalIds() {
        Map<String, String> input = row("date", "2025-02-01", "type", "transfer", "from_wallet_id", "1.9",
            "to_wallet_id", "2", "amount_original", "10", "currency", "KZT", "rate_at_operation", "1",
            "amount_kzt", "10");
        ParsedTransfer parsed = parser.parseTransfer(input, "row 2", ImportPolicy.FULL_BACKUP, 1, Set.of(1L, 2L));
        assertTrue(parsed.isError());
        assertEquals("row 2: invalid from_wallet_id '1.9'", parsed.getError());

        input.put("from_wallet_id", "1");
        input.put("to_wallet_id", "2.5");
        assertEquals("row 2: invalid to_wallet_id '2.5'",
            parser.parseTransfer(input, "row 2", ImportPolicy.FULL_BACKUP, 1, Set.of(1L, 2L)).getError());

        input.put("to_wallet_id", "2");
        input.put("transfer_id", "5.7");
        assertEquals("row 2: invalid transfer_id '5.7'",
            parser.parseTransfer(input, "row 2", ImportPolicy.FULL_BACKUP, 1, Set.of(1L, 2L)).getError());
    }
}
