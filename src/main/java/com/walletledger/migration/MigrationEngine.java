package com.walletledger.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletledger.common.Amounts;
import com.walletledger.common.exception.LedgerException;
import com.walletledger.common.exception.MigrationException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.json.JsonFileLedgerRepository;
import com.walletledger.storage.sqlite.SqliteDatabase;
import com.walletledger.storage.sqlite.SqliteRows;
import com.walletledger.transfers.Transfer;
import com.walletledger.wallets.Wallet;
import com.walletledger.wallets.WalletBalances;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copies a JSON ledger document into an SQLite database.
 *
 * The source is validated before anything is written. A non-empty target is either
 * recognised as an earlier run of the same migration, in which case nothing happens,
 * or refused. Into an empty target all rows are inserted in one transaction, which is
 * committed only after counts and wallet balances recomputed in SQL match the source.
 */
@Service
@Slf4j
public class MigrationEngine {

    static final String WALLETS = "wallets";
    static final String RECORDS = "records";
    static final String TRANSFERS = "transfers";
    static final String MANDATORY = "mandatory_expenses";

    private final ObjectMapper objectMapper;

    public MigrationEngine() {
        this(new ObjectMapper());
    }

    @Autowired
    public MigrationEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Validate the source and check the target can be opened with the schema. No rows are written.
     */
    public MigrationReport dryRun(MigrationRequest request) {
        Resource schema = schema(request);
        LedgerDataset source = loadSource(request);
        try (SqliteDatabase db = SqliteDatabase.open(request.getSqlitePath(), schema)) {
            if (!db.ping()) {
                throw new MigrationException("Target database " + request.getSqlitePath() + " did not answer");
            }
            log.info("Dry run OK: {} -> {}, source counts {}, target counts {}",
                request.getJsonPath(), request.getSqlitePath(), counts(source), db.countRows());
        } catch (LedgerException e) {
            throw asMigrationFailure(e);
        }
        return MigrationReport.builder()
            .outcome(MigrationOutcome.DRY_RUN_OK)
            .sourceCounts(counts(source))
            .insertedCounts(Map.of())
            .idsPreserved(Map.of())
            .build();
    }

    public MigrationReport migrate(MigrationRequest request) {
        Resource schema = schema(request);
        LedgerDataset source = loadSource(request);

        try (SqliteDatabase db = SqliteDatabase.open(request.getSqlitePath(), schema)) {
            if (db.hasData()) {
                List<String> differences = compareExisting(db, source);
                if (!differences.isEmpty()) {
                    throw new MigrationException("Target SQLite is not empty and differs from source JSON", differences);
                }
                log.info("Target {} already holds the migrated data, nothing to do", request.getSqlitePath());
                return MigrationReport.builder()
                    .outcome(MigrationOutcome.ALREADY_MIGRATED)
                    .sourceCounts(counts(source))
                    .insertedCounts(Map.of())
                    .idsPreserved(Map.of())
                    .build();
            }

            MigrationReport report = db.inTransaction(status -> copy(db, source));
            log.info("Migrated {} -> {}: {}", request.getJsonPath(), request.getSqlitePath(), report.getInsertedCounts());
            return report;
        } catch (DataAccessException e) {
            throw new MigrationException("Migration rolled back: " + e.getMessage(), e);
        } catch (LedgerException e) {
            throw asMigrationFailure(e);
        }
    }

    private static MigrationException asMigrationFailure(LedgerException e) {
        if (e instanceof MigrationException) {
            return (MigrationException) e;
        }
        return new MigrationException("Migration failed: " + e.getMessage(), e);
    }

    private Resource schema(MigrationRequest request) {
        Resource schema = request.getSchemaPath() == null
            ? SqliteDatabase.bundledSchema() : new FileSystemResource(request.getSchemaPath());
        if (!schema.exists()) {
            throw new MigrationException("Schema file not found: " + schema.getDescription());
        }
        return schema;
    }

    private LedgerDataset loadSource(MigrationRequest request) {
        if (!Files.exists(request.getJsonPath())) {
            throw new MigrationException("JSON source not found: " + request.getJsonPath());
        }
        LedgerDataset source;
        try {
            source = JsonFileLedgerRepository.readOnly(request.getJsonPath(), objectMapper).loadDataset();
        } catch (LedgerException e) {
            throw new MigrationException("Source validation failed: " + e.getMessage(), e);
        }
        List<String> errors = validateSource(source);
        if (!errors.isEmpty()) {
            throw new MigrationException("Source validation failed", errors);
        }
        return source;
    }

    static List<String> validateSource(LedgerDataset source) {
        List<String> errors = new ArrayList<>();
        if (source.getWallets().isEmpty()) {
            errors.add("source has no wallets");
            return errors;
        }
        Set<Long> walletIds = new HashSet<>();
        for (Wallet wallet : source.getWallets()) {
            if (!walletIds.add(wallet.getId())) {
                errors.add("duplicate wallet id " + wallet.getId());
            }
        }
        Set<Long> transferIds = new HashSet<>();
        for (Transfer transfer : source.getTransfers()) {
            if (!transferIds.add(transfer.getId())) {
                errors.add("duplicate transfer id " + transfer.getId());
            }
            if (!walletIds.contains(transfer.getFromWalletId()) || !walletIds.contains(transfer.getToWalletId())) {
                errors.add("transfer #" + transfer.getId() + " references a missing wallet");
            }
        }
        for (LedgerRecord record : source.getRecords()) {
            if (!walletIds.contains(record.getWalletId())) {
                errors.add("record #" + record.getId() + " references missing wallet " + record.getWalletId());
            }
            if (record.getDate() == null) {
                errors.add("record #" + record.getId() + " has no date");
            }
        }
        for (MandatoryExpenseRecord template : source.getMandatoryExpenses()) {
            if (!walletIds.contains(template.getWalletId())) {
                errors.add("mandatory expense #" + template.getId() + " references missing wallet "
                    + template.getWalletId());
            }
        }
        return errors;
    }

    /**
     * Insert the source in dependency order. Wallet and transfer ids are always kept: the
     * model rejects non-positive ids and {@link #validateSource} rejects duplicates, so every
     * foreign key can be written unchanged. Records and templates are referenced by nothing
     * and get fresh ids when their source ids are not positive and unique.
     */
    private MigrationReport copy(SqliteDatabase db, LedgerDataset source) {
        for (Wallet wallet : source.getWallets()) {
            SqliteRows.insertWallet(db, wallet, true);
        }
        for (Transfer transfer : source.getTransfers()) {
            SqliteRows.insertTransfer(db, transfer, true);
        }

        boolean keepRecordIds = idsPreservable(source.getRecords().stream().map(LedgerRecord::getId).toList());
        for (LedgerRecord record : source.getRecords()) {
            SqliteRows.insertRecord(db, record, keepRecordIds);
        }

        boolean keepTemplateIds =
            idsPreservable(source.getMandatoryExpenses().stream().map(LedgerRecord::getId).toList());
        for (MandatoryExpenseRecord template : source.getMandatoryExpenses()) {
            SqliteRows.insertMandatoryExpense(db, template, keepTemplateIds);
        }

        List<String> mismatches = verify(db, source);
        if (!mismatches.isEmpty()) {
            mismatches.forEach(m -> log.error("Migration verification failed: {}", m));
            throw new MigrationException("Migration verification failed, rolled back", mismatches);
        }

        Map<String, Boolean> preserved = new LinkedHashMap<>();
        preserved.put(WALLETS, true);
        preserved.put(RECORDS, keepRecordIds);
        preserved.put(TRANSFERS, true);
        preserved.put(MANDATORY, keepTemplateIds);
        return MigrationReport.builder()
            .outcome(MigrationOutcome.MIGRATED)
            .sourceCounts(counts(source))
            .insertedCounts(db.countRows())
            .idsPreserved(preserved)
            .build();
    }

    /**
     * Ids can be kept only when every id in the collection is positive and unique.
     */
    static boolean idsPreservable(Collection<Long> sourceIds) {
        Set<Long> seen = new HashSet<>();
        for (Long id : sourceIds) {
            if (id == null || id <= 0 || !seen.add(id)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Recompute counts and balances in SQL and compare them with the source.
     */
    private static List<String> verify(SqliteDatabase db, LedgerDataset source) {
        List<String> mismatches = new ArrayList<>(compareCounts(db.countRows(), counts(source)));

        Map<Long, Double> sourceBalances = WalletBalances.byWallet(source.getWallets(), source.getRecords());
        Map<Long, Double> targetBalances = db.walletBalances();
        for (Map.Entry<Long, Double> entry : sourceBalances.entrySet()) {
            Double target = targetBalances.get(entry.getKey());
            if (target == null || !Amounts.equal(target, entry.getValue())) {
                mismatches.add(String.format("balance mismatch for wallet %d: source=%.6f target=%s",
                    entry.getKey(), entry.getValue(), target));
            }
        }
        compareNetWorth(sourceBalances, targetBalances, mismatches);
        return mismatches;
    }

    /**
     * Compare a non-empty target with the source, taking ids as equal on both sides.
     */
    private static List<String> compareExisting(SqliteDatabase db, LedgerDataset source) {
        List<String> differences = new ArrayList<>(compareCounts(db.countRows(), counts(source)));
        Map<Long, Double> sourceBalances = WalletBalances.byWallet(source.getWallets(), source.getRecords());
        Map<Long, Double> targetBalances = db.walletBalances();
        for (Map.Entry<Long, Double> entry : sourceBalances.entrySet()) {
            Double target = targetBalances.get(entry.getKey());
            if (target == null || !Amounts.equal(target, entry.getValue())) {
                differences.add(String.format("wallet %d balance: source=%.6f target=%s",
                    entry.getKey(), entry.getValue(), target));
            }
        }
        compareNetWorth(sourceBalances, targetBalances, differences);
        return differences;
    }

    private static List<String> compareCounts(Map<String, Integer> target, Map<String, Integer> source) {
        List<String> differences = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : source.entrySet()) {
            int actual = target.getOrDefault(entry.getKey(), 0);
            if (actual != entry.getValue()) {
                differences.add(String.format("%s count: source=%d target=%d", entry.getKey(), entry.getValue(), actual));
            }
        }
        return differences;
    }

    private static void compareNetWorth(Map<Long, Double> source, Map<Long, Double> target, List<String> differences) {
        double sourceTotal = source.values().stream().mapToDouble(Double::doubleValue).sum();
        double targetTotal = target.values().stream().mapToDouble(Double::doubleValue).sum();
        if (!Amounts.equal(sourceTotal, targetTotal)) {
            differences.add(String.format("net worth mismatch: source=%.6f target=%.6f", sourceTotal, targetTotal));
        }
    }

    static Map<String, Integer> counts(LedgerDataset dataset) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(WALLETS, dataset.getWallets().size());
        counts.put(TRANSFERS, dataset.getTransfers().size());
        counts.put(RECORDS, dataset.getRecords().size());
        counts.put(MANDATORY, dataset.getMandatoryExpenses().size());
        return counts;
    }
}
