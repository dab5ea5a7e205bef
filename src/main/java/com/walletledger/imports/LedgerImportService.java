package com.walletledger.imports;

import com.walletledger.common.exception.ImportRejectedException;
import com.walletledger.config.LedgerStoreProperties;
import com.walletledger.currency.CurrencyRateProvider;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.records.RecordType;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerMutations;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.transfers.Transfer;
import com.walletledger.wallets.Wallet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Batch import of rows into the ledger.
 *
 * A replace is all-or-nothing: if any row is rejected the store is left exactly as it was.
 * Rows are labelled {@code row N} counting from 2, the first line of a file being its header.
 */
@Service
@Slf4j
public class LedgerImportService {

    private static final int FIRST_ROW_NUMBER = 2;
    private static final int ERRORS_IN_MESSAGE = 3;

    private final LedgerRepository repository;
    private final ImportRowParser parser;
    private final int maxRows;

    @Autowired
    public LedgerImportService(LedgerRepository repository, CurrencyRateProvider rateProvider,
                               LedgerStoreProperties properties) {
        this(repository, new ImportRowParser(rateProvider), properties.getImports().getMaxRows());
    }

    public LedgerImportService(LedgerRepository repository, ImportRowParser parser, int maxRows) {
        this.repository = repository;
        this.parser = parser;
        this.maxRows = maxRows;
    }

    /**
     * Parse a batch without touching the store.
     *
     * @param walletIds wallets rows may reference, or {@code null} to accept any
     * @throws ImportRejectedException if the batch is larger than the row limit
     */
    public ImportBatch parseRows(List<? extends Map<String, ?>> rows, ImportPolicy policy, Set<Long> walletIds) {
        ensureWithinLimit(rows);

        List<LedgerRecord> records = new ArrayList<>();
        Map<Long, Transfer> transfers = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        Double initialBalance = null;
        int imported = 0;
        int skipped = 0;
        long nextTransferId = 1;

        for (int i = 0; i < rows.size(); i++) {
            String label = "row " + (i + FIRST_ROW_NUMBER);
            Map<String, String> row = ImportRowParser.normalize(rows.get(i));
            if (ImportRowParser.isBlank(row)) {
                continue;
            }

            if (ImportRowParser.TRANSFER_TYPE.equals(ImportRowParser.rowType(row))) {
                ParsedTransfer parsed = parser.parseTransfer(row, label, policy, nextTransferId, walletIds);
                if (parsed.isError()) {
                    skipped++;
                    errors.add(parsed.getError());
                    log.warn("Import skipped {}", parsed.getError());
                    continue;
                }
                Transfer transfer = parsed.getTransfer();
                nextTransferId = Math.max(nextTransferId, transfer.getId() + 1);
                if (transfers.containsKey(transfer.getId())) {
                    skipped++;
                    errors.add(label + ": duplicate transfer_id #" + transfer.getId());
                    continue;
                }
                transfers.put(transfer.getId(), transfer);
                records.addAll(parsed.getLegs());
                imported++;
                continue;
            }

            ParsedRow parsed = parser.parse(row, label, policy, false);
            if (parsed.isError()) {
                skipped++;
                errors.add(parsed.getError());
                log.warn("Import skipped {}", parsed.getError());
                continue;
            }
            if (parsed.isInitialBalance()) {
                if (initialBalance != null) {
                    skipped++;
                    errors.add(label + ": duplicate initial_balance");
                    continue;
                }
                initialBalance = parsed.getInitialBalance();
                continue;
            }
            LedgerRecord record = parsed.getRecord();
            if (walletIds != null && !walletIds.contains(record.getWalletId())) {
                skipped++;
                errors.add(label + ": wallet not found (" + record.getWalletId() + ")");
                log.warn("Import skipped {} due to missing wallet {}", label, record.getWalletId());
                continue;
            }
            records.add(record);
            imported++;
            if (record.getTransferId() != null) {
                nextTransferId = Math.max(nextTransferId, record.getTransferId() + 1);
            }
        }

        restoreMissingTransfers(records, transfers);
        List<String> integrityErrors = validateTransfers(records, transfers, walletIds);
        skipped += integrityErrors.size();
        errors.addAll(integrityErrors);

        List<LedgerRecord> numbered = new ArrayList<>(records.size());
        long recordId = 1;
        for (LedgerRecord record : records) {
            numbered.add(record.withId(recordId++));
        }
        log.info("Parsed import batch: imported={}, skipped={}, policy={}", imported, skipped, policy);
        return new ImportBatch(numbered, new ArrayList<>(new TreeMap<>(transfers).values()),
            initialBalance, new ImportSummary(imported, skipped, errors));
    }

    /**
     * Replace all records and transfers with the rows, and set the system wallet's initial
     * balance when the rows carry one.
     *
     * @throws ImportRejectedException if any row is invalid; the store is then untouched
     */
    public ImportSummary replaceFromRows(List<? extends Map<String, ?>> rows, ImportPolicy policy) {
        LedgerDataset current = repository.loadDataset();
        ImportBatch batch = parseRows(rows, policy, walletIds(current));
        ensureValid(batch.getSummary());

        List<Wallet> wallets = new ArrayList<>(current.getWallets());
        if (batch.getInitialBalance() != null) {
            Wallet system = current.systemWallet().toBuilder().initialBalance(batch.getInitialBalance()).build();
            wallets.removeIf(w -> w.getId() == system.getId());
            wallets.add(0, system);
        }
        repository.replaceAllData(current.toBuilder()
            .wallets(wallets)
            .records(batch.getRecords())
            .transfers(batch.getTransfers())
            .build());
        log.info("Import replaced ledger: {} records, {} transfers",
            batch.getRecords().size(), batch.getTransfers().size());
        return batch.getSummary();
    }

    /**
     * Replace all mandatory expense templates with the rows.
     *
     * @throws ImportRejectedException if any row is invalid; the store is then untouched
     */
    public ImportSummary replaceMandatoryFromRows(List<? extends Map<String, ?>> rows, ImportPolicy policy) {
        ensureWithinLimit(rows);
        LedgerDataset current = repository.loadDataset();
        Set<Long> walletIds = walletIds(current);

        List<MandatoryExpenseRecord> templates = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < rows.size(); i++) {
            String label = "row " + (i + FIRST_ROW_NUMBER);
            Map<String, String> row = ImportRowParser.normalize(rows.get(i));
            if (ImportRowParser.isBlank(row)) {
                continue;
            }
            ParsedRow parsed = parser.parse(row, label, policy, true);
            if (parsed.isError() || parsed.isInitialBalance()) {
                skipped++;
                errors.add(parsed.isError() ? parsed.getError() : label + ": unexpected initial_balance row");
                continue;
            }
            LedgerRecord record = parsed.getRecord();
            if (!walletIds.contains(record.getWalletId())) {
                skipped++;
                errors.add(label + ": wallet not found (" + record.getWalletId() + ")");
                continue;
            }
            templates.add((MandatoryExpenseRecord) record.withId(templates.size() + 1L));
        }

        ImportSummary summary = new ImportSummary(templates.size(), skipped, errors);
        ensureValid(summary);
        repository.replaceAllData(current.toBuilder().mandatoryExpenses(templates).build());
        log.info("Import replaced {} mandatory expense templates", templates.size());
        return summary;
    }

    private void ensureWithinLimit(List<?> rows) {
        if (rows.size() > maxRows) {
            throw new ImportRejectedException(String.format(
                "Import rejected: %d rows exceed the row limit of %d", rows.size(), maxRows));
        }
    }

    private static void ensureValid(ImportSummary summary) {
        if (summary.getSkipped() > 0) {
            String firstErrors = summary.getErrors().stream()
                .limit(ERRORS_IN_MESSAGE)
                .collect(Collectors.joining("; "));
            throw new ImportRejectedException(String.format(
                "Import aborted: %d invalid rows (%s)", summary.getSkipped(), firstErrors), summary);
        }
    }

    private static Set<Long> walletIds(LedgerDataset dataset) {
        Set<Long> ids = new HashSet<>();
        for (Wallet wallet : dataset.getWallets()) {
            ids.add(wallet.getId());
        }
        if (ids.isEmpty()) {
            ids.add(Wallet.SYSTEM_WALLET_ID);
        }
        return ids;
    }

    /**
     * Rebuild transfers for leg rows that carry a {@code transfer_id} but had no transfer row.
     */
    private static void restoreMissingTransfers(List<LedgerRecord> records, Map<Long, Transfer> transfers) {
        Map<Long, List<LedgerRecord>> byTransfer = groupByTransfer(records);
        for (Map.Entry<Long, List<LedgerRecord>> entry : byTransfer.entrySet()) {
            if (transfers.containsKey(entry.getKey())) {
                continue;
            }
            LedgerRecord expense = find(entry.getValue(), RecordType.EXPENSE);
            LedgerRecord income = find(entry.getValue(), RecordType.INCOME);
            if (expense == null || income == null || expense.getWalletId() == income.getWalletId()
                || !(expense.getAmountOriginal() > 0) || !(expense.getAmountKzt() > 0)) {
                continue;
            }
            transfers.put(entry.getKey(), Transfer.builder()
                .id(entry.getKey())
                .fromWalletId(expense.getWalletId())
                .toWalletId(income.getWalletId())
                .date(expense.getDate())
                .amountOriginal(expense.getAmountOriginal())
                .currency(expense.getCurrency())
                .amountKzt(expense.getAmountKzt())
                .description(expense.getDescription())
                .build());
        }
    }

    private static List<String> validateTransfers(List<LedgerRecord> records, Map<Long, Transfer> transfers,
                                                  Set<Long> walletIds) {
        List<String> errors = new ArrayList<>();
        Map<Long, List<LedgerRecord>> byTransfer = groupByTransfer(records);

        for (Long transferId : new TreeMap<>(byTransfer).keySet()) {
            if (!transfers.containsKey(transferId)) {
                errors.add("Transfer #" + transferId + ": missing transfer aggregate");
            }
        }
        for (LedgerRecord record : records) {
            Long commissionFor = record.getCommissionForTransferId();
            if (commissionFor != null && !transfers.containsKey(commissionFor)) {
                errors.add("Transfer #" + commissionFor + ": commission refers to a missing transfer");
            }
        }

        for (Transfer transfer : new TreeMap<>(transfers).values()) {
            long id = transfer.getId();
            List<LedgerRecord> linked = byTransfer.getOrDefault(id, List.of());
            if (linked.size() != 2) {
                errors.add("Transfer integrity violated for #" + id + ": expected 2 linked records, got "
                    + linked.size());
                continue;
            }
            LedgerRecord expense = find(linked, RecordType.EXPENSE);
            LedgerRecord income = find(linked, RecordType.INCOME);
            if (expense == null || income == null) {
                errors.add("Transfer integrity violated for #" + id + ": requires one expense and one income");
                continue;
            }
            if (expense.getWalletId() != transfer.getFromWalletId()) {
                errors.add("Transfer #" + id + ": from_wallet_id mismatch");
            }
            if (income.getWalletId() != transfer.getToWalletId()) {
                errors.add("Transfer #" + id + ": to_wallet_id mismatch");
            }
            String mismatch = ImportRowParser.legMismatch(expense, income);
            if (mismatch != null) {
                errors.add("Transfer #" + id + ": " + mismatch);
            }
            if (walletIds != null) {
                for (long walletId : new long[] {transfer.getFromWalletId(), transfer.getToWalletId()}) {
                    if (!walletIds.contains(walletId)) {
                        errors.add("Transfer #" + id + ": wallet not found (" + walletId + ")");
                    }
                }
            }
        }
        return errors;
    }

    private static Map<Long, List<LedgerRecord>> groupByTransfer(List<LedgerRecord> records) {
        Map<Long, List<LedgerRecord>> byTransfer = new LinkedHashMap<>();
        for (LedgerRecord record : records) {
            if (record.getTransferId() != null) {
                byTransfer.computeIfAbsent(record.getTransferId(), id -> new ArrayList<>()).add(record);
            }
        }
        return byTransfer;
    }

    private static LedgerRecord find(List<LedgerRecord> records, RecordType type) {
        return records.stream().filter(r -> r.getType() == type).findFirst().orElse(null);
    }
}
