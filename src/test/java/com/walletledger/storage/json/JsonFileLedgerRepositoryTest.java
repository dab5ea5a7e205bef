package com.walletledger.storage.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletledger.common.exception.DanglingTransferLinkException;
import com.walletledger.common.exception.RecordNotFoundException;
import com.walletledger.common.exception.StorageException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.records.MandatoryPeriod;
import com.walletledger.records.RecordType;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.transfers.Transfer;
import com.walletledger.wallets.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JSON document store: legacy upgrade, atomic writes and integrity checks.
 */
class JsonFileLedgerRepositoryTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 20);

    @TempDir
    Path tempDir;

    private Path file;
    private JsonFileLedgerRepository repository;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("data.json");
        repository = new JsonFileLedgerRepository(file, objectMapper);
    }

    private static LedgerRecord record(RecordType type, double amountKzt, Long transferId, long walletId) {
        return LedgerRecord.builder()
            .type(type)
            .date(DATE)
            .walletId(walletId)
            .transferId(transferId)
            .amountOriginal(amountKzt)
            .currency("KZT")
            .amountKzt(amountKzt)
            .category(transferId == null ? "Food" : "Transfer")
            .build();
    }

    @Test
    void testMissingFileStartsWithSystemWallet() {
        List<Wallet> wallets = repository.loadWallets();

        assertEquals(1, wallets.size());
        assertTrue(wallets.get(0).isSystem());
        assertEquals(Wallet.SYSTEM_WALLET_ID, wallets.get(0).getId());
        assertFalse(Files.exists(file));
    }

    @Test
    void testLegacyArrayUpgradedInPlace() throws IOException {
        Files.writeString(file, """
            [
              {"date": "2024-01-01", "type": "income", "amount": 100, "category": "Salary"},
              {"date": "2024-01-02", "type": "expense", "amount": -30, "category": "Food"}
            ]
            """);

        List<LedgerRecord> records = repository.loadAll();

        assertEquals(2, records.size());
        assertEquals(1, records.get(0).getId());
        assertEquals(2, records.get(1).getId());
        assertEquals(30.0, records.get(1).getAmountKzt());
        assertEquals("KZT", records.get(1).getCurrency());
        assertEquals(Wallet.SYSTEM_WALLET_ID, records.get(1).getWalletId());

        // The file now carries the current layout
        JsonNode root = objectMapper.readTree(file.toFile());
        assertTrue(root.has("wallets"));
        assertEquals(2, root.get("records").size());
        assertFalse(root.get("records").get(0).has("amount"));
    }

    @Test
    void testLegacyObjectMovesInitialBalanceToSystemWallet() throws IOException {
        Files.writeString(file, """
            {"initial_balance": 250.5, "records": [
              {"date": "2024-03-01", "type": "expense", "amount_original": 10, "currency": "USD",
               "rate_at_operation": 500, "category": "Books"}
            ]}
            """);

        assertEquals(250.5, repository.loadInitialBalance());
        LedgerRecord record = repository.loadAll().get(0);
        assertEquals(5000.0, record.getAmountKzt(), 1e-9);
        assertEquals(500.0, record.getRateAtOperation(), 1e-9);
    }

    @Test
    void testReadOnlyLeavesLegacyFileUntouched() throws IOException {
        Files.writeString(file, "[{\"date\": \"2024-01-01\", \"type\": \"income\", \"amount\": 5}]");
        byte[] before = Files.readAllBytes(file);

        LedgerDataset dataset = JsonFileLedgerRepository.readOnly(file, objectMapper).loadDataset();

        assertEquals(1, dataset.getRecords().size());
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void testCorruptedDocument() throws IOException {
        Files.writeString(file, "{\"wallets\": [", StandardCharsets.UTF_8);
        assertThrows(StorageException.class, () -> repository.loadAll());

        Files.writeString(file, "{\"wallets\": [], \"records\": [{\"date\": \"2024-02-30\", \"type\": \"income\"}]}");
        StorageException e = assertThrows(StorageException.class, () -> repository.loadAll());
        assertTrue(e.getMessage().contains("Corrupted ledger document"));
    }

    @Test
    void testSaveAssignsIdsAndRoundTrips() {
        LedgerRecord first = repository.save(record(RecordType.INCOME, 100, null, 1));
        LedgerRecord second = repository.save(record(RecordType.EXPENSE, 40, null, 1));

        assertEquals(1, first.getId());
        assertEquals(2, second.getId());

        JsonFileLedgerRepository reopened = new JsonFileLedgerRepository(file, objectMapper);
        assertEquals(List.of(first, second), reopened.loadAll());
        assertEquals(second, reopened.getById(2).orElseThrow());
    }

    @Test
    void testWriteLeavesNoTempFiles() throws IOException {
        repository.save(record(RecordType.INCOME, 100, null, 1));
        repository.saveInitialBalance(10);

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void testBrokenTransferIsNeverWritten() throws IOException {
        repository.save(record(RecordType.INCOME, 100, null, 1));
        byte[] before = Files.readAllBytes(file);

        assertThrows(DanglingTransferLinkException.class, () -> repository.replaceRecordsAndTransfers(
            List.of(record(RecordType.EXPENSE, 10, 3L, 1)), List.of()));

        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void testDeleteByIndexCascadesToTransfer() {
        Wallet second = repository.createWallet("Savings", "KZT", 0, false);
        Transfer transfer = Transfer.builder()
            .id(1)
            .fromWalletId(1)
            .toWalletId(second.getId())
            .date(DATE)
            .amountOriginal(25)
            .currency("KZT")
            .amountKzt(25)
            .build();
        repository.replaceRecordsAndTransfers(List.of(
            record(RecordType.INCOME, 100, null, 1).withId(1),
            record(RecordType.EXPENSE, 25, 1L, 1).withId(2),
            record(RecordType.INCOME, 25, 1L, second.getId()).withId(3)), List.of(transfer));

        repository.deleteByIndex(2);

        assertEquals(1, repository.loadAll().size());
        assertTrue(repository.loadTransfers().isEmpty());
        assertThrows(RecordNotFoundException.class, () -> repository.deleteByIndex(5));
    }

    @Test
    void testMandatoryTemplates() {
        LedgerRecord template = LedgerRecord.builder()
            .type(RecordType.MANDATORY_EXPENSE)
            .walletId(1)
            .amountOriginal(15)
            .currency("KZT")
            .amountKzt(15)
            .category("Internet")
            .period(MandatoryPeriod.WEEKLY)
            .build();

        MandatoryExpenseRecord stored = repository.saveMandatoryExpense((MandatoryExpenseRecord) template);

        assertEquals(1, stored.getId());
        List<MandatoryExpenseRecord> templates = repository.loadMandatoryExpenses();
        assertEquals(1, templates.size());
        assertNull(templates.get(0).getDate());
        assertEquals(MandatoryPeriod.WEEKLY, templates.get(0).getPeriod());

        repository.deleteMandatoryExpenseByIndex(0);
        assertTrue(repository.loadMandatoryExpenses().isEmpty());
    }
}
