package com.walletledger;

import com.walletledger.currency.CurrencyRateProvider;
import com.walletledger.imports.ImportPolicy;
import com.walletledger.imports.LedgerExportService;
import com.walletledger.imports.LedgerImportService;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.RecordService;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.storage.sqlite.SqliteLedgerRepository;
import com.walletledger.transfers.TransferRequest;
import com.walletledger.transfers.TransferService;
import com.walletledger.wallets.Wallet;
import com.walletledger.wallets.WalletService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the wired application on the SQLite backend.
 */
@SpringBootTest
@ActiveProfiles("test")
class WalletLedgerApplicationTest {

    private static final Path DATA_DIR;

    static {
        try {
            DATA_DIR = Files.createTempDirectory("wallet-ledger-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void storePaths(DynamicPropertyRegistry registry) {
        registry.add("ledger.store.json-path", () -> DATA_DIR.resolve("data.json").toString());
        registry.add("ledger.store.sqlite-path", () -> DATA_DIR.resolve("finance.db").toString());
    }

    @Autowired
    private LedgerRepository repository;

    @Autowired
    private WalletService walletService;

    @Autowired
    private RecordService recordService;

    @Autowired
    private TransferService transferService;

    @Autowired
    private LedgerExportService exportService;

    @Autowired
    private LedgerImportService importService;

    @Autowired
    private CurrencyRateProvider rateProvider;

    @Test
    void testContextUsesSqliteStore() {
        assertInstanceOf(SqliteLedgerRepository.class, repository);
        assertEquals("KZT", rateProvider.getBaseCurrency());
        assertTrue(Files.exists(DATA_DIR.resolve("data.json")));
        assertTrue(walletService.listWallets().stream().anyMatch(Wallet::isSystem));
    }

    @Test
    void testRecordAndTransferFlow() {
        LocalDate date = LocalDate.of(2025, 5, 1);
        Wallet card = walletService.createWallet("Card", "KZT", 1000, false);
        Wallet cash = walletService.createWallet("Cash", "KZT", 500, false);
        double netWorthBefore = walletService.getNetWorth();

        // Income in foreign currency at the configured rate
        LedgerRecord income = recordService.createIncome(card.getId(), date, 2, "USD", "Salary", "");
        assertEquals(1000.0, income.getAmountKzt(), 1e-9);

        transferService.createTransfer(TransferRequest.builder()
            .fromWalletId(card.getId())
            .toWalletId(cash.getId())
            .date(date)
            .amount(100)
            .currency("KZT")
            .build());

        Map<Long, Double> balances = walletService.getBalances();
        assertEquals(1900.0, balances.get(card.getId()), 1e-9);
        assertEquals(600.0, balances.get(cash.getId()), 1e-9);
        assertEquals(netWorthBefore + 1000, walletService.getNetWorth(), 1e-9);

        // Export and re-import leaves the ledger unchanged
        List<Map<String, String>> rows = exportService.exportRows();
        importService.replaceFromRows(rows, ImportPolicy.FULL_BACKUP);
        Map<Long, Double> reimported = walletService.getBalances();
        assertEquals(balances.keySet(), reimported.keySet());
        balances.forEach((id, balance) -> assertEquals(balance, reimported.get(id), 1e-6));
    }
}
