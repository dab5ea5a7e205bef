package com.walletledger.imports;

import com.walletledger.currency.StaticCurrencyRateProvider;
import com.walletledger.records.MandatoryExpenseService;
import com.walletledger.records.MandatoryPeriod;
import com.walletledger.records.RecordService;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.json.JsonFileLedgerRepository;
import com.walletledger.transfers.TransferRequest;
import com.walletledger.transfers.TransferService;
import com.walletledger.wallets.Wallet;
import com.walletledger.wallets.WalletBalances;
import com.walletledger.wallets.WalletService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exported rows must import back into an equivalent ledger.
 */
class LedgerExportServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 2, 10);

    @TempDir
    Path tempDir;

    private final StaticCurrencyRateProvider rates = new StaticCurrencyRateProvider("KZT", Map.of("USD", 500.0));

    private JsonFileLedgerRepository source;
    private Wallet cash;

    @BeforeEach
    void setUp() {
        source = new JsonFileLedgerRepository(tempDir.resolve("source.json"));
        source.saveInitialBalance(2000);
        cash = new WalletService(source).createWallet("Cash", "KZT", 100, false);

        RecordService records = new RecordService(source, rates);
        records.createIncome(1, DATE, 3, "USD", "Salary", "bonus");
        records.createExpense(1, DATE, 250, "KZT", "Food", "");

        new TransferService(source, rates).createTransfer(TransferRequest.builder()
            .fromWalletId(1)
            .toWalletId(cash.getId())
            .date(DATE)
            .amount(1)
            .currency("USD")
            .commission(20)
            .commissionCurrency("KZT")
            .description("atm")
            .build());

        MandatoryExpenseService templates = new MandatoryExpenseService(source, rates);
        templates.addTemplate(1, 100, "KZT", "Rent", "flat", MandatoryPeriod.MONTHLY);
        templates.applyTemplate(0, DATE, cash.getId());
    }

    @Test
    void testExportShape() {
        List<Map<String, String>> rows = new LedgerExportService(source).exportRows();

        // initial balance, income, expense, commission, applied template, one transfer row
        assertEquals(6, rows.size());
        assertEquals("initial_balance", rows.get(0).get("type"));
        assertEquals("2000", rows.get(0).get("amount_original"));
        assertEquals("1500", rows.get(1).get("amount_kzt"));
        assertEquals("1", rows.get(3).get("commission_for_transfer_id"));
        assertEquals("mandatory_expense", rows.get(4).get("type"));
        assertEquals("monthly", rows.get(4).get("period"));
        Map<String, String> transfer = rows.get(5);
        assertEquals("transfer", transfer.get("type"));
        assertEquals("1", transfer.get("from_wallet_id"));
        assertEquals(String.valueOf(cash.getId()), transfer.get("to_wallet_id"));
        assertEquals(LedgerExportService.DATA_HEADERS, List.copyOf(transfer.keySet()));

        List<Map<String, String>> mandatory = new LedgerExportService(source).exportMandatoryRows();
        assertEquals(1, mandatory.size());
        assertEquals(LedgerExportService.MANDATORY_HEADERS, List.copyOf(mandatory.get(0).keySet()));
    }

    @Test
    void testExportImportRoundTrip() {
        LedgerExportService exporter = new LedgerExportService(source);
        List<Map<String, String>> rows = exporter.exportRows();
        List<Map<String, String>> mandatoryRows = exporter.exportMandatoryRows();

        JsonFileLedgerRepository target = new JsonFileLedgerRepository(tempDir.resolve("target.json"));
        new WalletService(target).createWallet("Cash", "KZT", 100, false);
        LedgerImportService importer = new LedgerImportService(target, new ImportRowParser(rates), 1000);

        importer.replaceFromRows(rows, ImportPolicy.FULL_BACKUP);
        importer.replaceMandatoryFromRows(mandatoryRows, ImportPolicy.FULL_BACKUP);

        LedgerDataset expected = source.loadDataset();
        LedgerDataset actual = target.loadDataset();
        assertEquals(expected.getRecords().size(), actual.getRecords().size());
        assertEquals(expected.getTransfers(), actual.getTransfers());
        assertEquals(expected.getMandatoryExpenses(), actual.getMandatoryExpenses());
        Map<Long, Double> expectedBalances = WalletBalances.byWallet(expected.getWallets(), expected.getRecords());
        Map<Long, Double> actualBalances = WalletBalances.byWallet(actual.getWallets(), actual.getRecords());
        assertEquals(expectedBalances.keySet(), actualBalances.keySet());
        expectedBalances.forEach((id, balance) -> assertEquals(balance, actualBalances.get(id), 1e-6));
    }

    @Test
    void testTransferCategorySurvivesRoundTrip() {
        List<Map<String, String>> rows = new LedgerExportService(source).exportRows();
        rows.get(5).put("category", "Savings");

        JsonFileLedgerRepository target = new JsonFileLedgerRepository(tempDir.resolve("target.json"));
        new WalletService(target).createWallet("Cash", "KZT", 100, false);
        new LedgerImportService(target, new ImportRowParser(rates), 1000)
            .replaceFromRows(rows, ImportPolicy.FULL_BACKUP);

        assertTrue(target.loadAll().stream()
            .filter(record -> record.isTransferLeg())
            .allMatch(record -> "Savings".equals(record.getCategory())));
        Map<String, String> exported = new LedgerExportService(target).exportRows().get(5);
        assertEquals("transfer", exported.get("type"));
        assertEquals("Savings", exported.get("category"));
    }
}
