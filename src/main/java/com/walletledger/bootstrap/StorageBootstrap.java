package com.walletledger.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletledger.common.Amounts;
import com.walletledger.common.exception.LedgerException;
import com.walletledger.common.exception.StartupIntegrityException;
import com.walletledger.config.LedgerStoreProperties;
import com.walletledger.migration.MigrationEngine;
import com.walletledger.migration.MigrationReport;
import com.walletledger.migration.MigrationRequest;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.storage.json.JsonFileLedgerRepository;
import com.walletledger.storage.sqlite.SqliteDatabase;
import com.walletledger.storage.sqlite.SqliteLedgerRepository;
import com.walletledger.wallets.Wallet;
import com.walletledger.wallets.WalletBalances;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens the configured store at startup.
 *
 * With the SQLite backend the JSON document is backed up, migrated into an empty database,
 * cross-checked against the database and finally rewritten from it, so both stores hold the
 * same ledger once startup completes. Any disagreement stops startup.
 */
@Slf4j
@RequiredArgsConstructor
public class StorageBootstrap {

    private final LedgerStoreProperties.Store settings;
    private final MigrationEngine migrationEngine;
    private final JsonBackupService backupService;
    private final ObjectMapper objectMapper;

    private LedgerRepository opened;

    public LedgerRepository bootstrapRepository() {
        Path jsonPath = Path.of(settings.getJsonPath());
        if (settings.getBackend() == LedgerStoreProperties.Backend.JSON) {
            log.info("Using JSON store {}", jsonPath);
            opened = new JsonFileLedgerRepository(jsonPath, objectMapper);
            return opened;
        }

        Path sqlitePath = Path.of(settings.getSqlitePath());
        boolean jsonExists = Files.exists(jsonPath);

        if (jsonExists && settings.isBackupEnabled()) {
            backupService.createBackup(jsonPath,
                settings.getBackupDir() == null ? null : Path.of(settings.getBackupDir()));
        }

        SqliteDatabase db = SqliteDatabase.open(sqlitePath, SqliteDatabase.schemaResource(settings.getSchemaPath()));
        boolean empty = !db.hasData();
        db.close();

        if (empty && jsonExists) {
            migrate(jsonPath, sqlitePath);
        }

        SqliteLedgerRepository repository = new SqliteLedgerRepository(
            SqliteDatabase.open(sqlitePath, SqliteDatabase.schemaResource(settings.getSchemaPath())));
        try {
            if (empty && !jsonExists) {
                repository.saveWallet(Wallet.systemDefault(0.0));
            }
            if (jsonExists) {
                verifyAgainstJson(repository, jsonPath);
            }
            backupService.exportToJson(repository, jsonPath);
        } catch (RuntimeException e) {
            repository.close();
            throw e;
        }
        log.info("Using SQLite store {}", sqlitePath);
        opened = repository;
        return repository;
    }

    /**
     * Mirror the SQLite store to JSON once more and close it, so the next startup
     * cross-check sees both stores equal.
     */
    public void shutdown() {
        if (opened == null) {
            return;
        }
        try {
            if (opened instanceof SqliteLedgerRepository) {
                backupService.exportToJson(opened, Path.of(settings.getJsonPath()));
            }
        } finally {
            opened.close();
            opened = null;
        }
    }

    private void migrate(Path jsonPath, Path sqlitePath) {
        MigrationRequest request = MigrationRequest.builder()
            .jsonPath(jsonPath)
            .sqlitePath(sqlitePath)
            .schemaPath(settings.getSchemaPath() == null || settings.getSchemaPath().isBlank()
                ? null : Path.of(settings.getSchemaPath()))
            .build();
        try {
            MigrationReport report = migrationEngine.migrate(request);
            log.info("Startup migration {}: {}", report.getOutcome(), report.getSourceCounts());
        } catch (LedgerException e) {
            throw new StartupIntegrityException("Startup migration from " + jsonPath + " failed: " + e.getMessage(), e);
        }
    }

    private void verifyAgainstJson(LedgerRepository sqlite, Path jsonPath) {
        LedgerDataset json;
        try {
            json = JsonFileLedgerRepository.readOnly(jsonPath, objectMapper).loadDataset();
        } catch (LedgerException e) {
            throw new StartupIntegrityException("Cannot read " + jsonPath + " for verification: " + e.getMessage(), e);
        }
        LedgerDataset db = sqlite.loadDataset();

        List<String> differences = new ArrayList<>();
        compare("wallets", json.getWallets().size(), db.getWallets().size(), differences);
        compare("records", json.getRecords().size(), db.getRecords().size(), differences);
        compare("transfers", json.getTransfers().size(), db.getTransfers().size(), differences);

        double jsonTotal = WalletBalances.totalBalance(json.getWallets(), json.getRecords());
        double dbTotal = WalletBalances.totalBalance(db.getWallets(), db.getRecords());
        if (!Amounts.equal(jsonTotal, dbTotal)) {
            differences.add(String.format("net worth json=%.6f sqlite=%.6f", jsonTotal, dbTotal));
        }

        if (!differences.isEmpty()) {
            differences.forEach(d -> log.error("Startup verification mismatch: {}", d));
            throw new StartupIntegrityException("JSON and SQLite stores disagree: " + String.join("; ", differences));
        }
    }

    private static void compare(String table, int json, int sqlite, List<String> differences) {
        if (json != sqlite) {
            differences.add(String.format("%s json=%d sqlite=%d", table, json, sqlite));
        }
    }
}
