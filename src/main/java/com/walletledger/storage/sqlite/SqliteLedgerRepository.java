package com.walletledger.storage.sqlite;

import com.walletledger.common.exception.RecordNotFoundException;
import com.walletledger.common.exception.StorageException;
import com.walletledger.common.exception.TransferNotFoundException;
import com.walletledger.common.exception.ValidationException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.transfers.Transfer;
import com.walletledger.transfers.TransferIntegrity;
import com.walletledger.wallets.Wallet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ledger store backed by SQLite.
 *
 * Multi-row writes run in one transaction. Wallets and transfers are upserted by id.
 * Transfer integrity is checked on every load and inside write transactions before commit.
 */
@Slf4j
public class SqliteLedgerRepository implements LedgerRepository {

    private final SqliteDatabase db;

    public SqliteLedgerRepository(SqliteDatabase db) {
        this.db = db;
    }

    private JdbcTemplate jdbc() {
        return db.jdbc().getJdbcTemplate();
    }

    // Wallets

    @Override
    public List<Wallet> loadWallets() {
        return query(() -> jdbc().query(
            "SELECT " + SqliteRows.WALLET_COLUMNS + " FROM wallets ORDER BY id", SqliteRows.WALLET));
    }

    @Override
    public List<Wallet> loadActiveWallets() {
        return query(() -> jdbc().query(
            "SELECT " + SqliteRows.WALLET_COLUMNS + " FROM wallets WHERE is_active = 1 ORDER BY id",
            SqliteRows.WALLET));
    }

    @Override
    public Wallet createWallet(String name, String currency, double initialBalance, boolean allowNegative) {
        return query(() -> db.inTransaction(status -> {
            Long maxId = jdbc().queryForObject("SELECT COALESCE(MAX(id), 0) FROM wallets", Long.class);
            Wallet wallet = Wallet.builder()
                .id((maxId == null ? 0 : maxId) + 1)
                .name(name)
                .currency(currency)
                .initialBalance(initialBalance)
                .allowNegative(allowNegative)
                .active(true)
                .build();
            SqliteRows.insertWallet(db, wallet, true);
            return wallet;
        }));
    }

    @Override
    public void saveWallet(Wallet wallet) {
        String sql = """
            INSERT INTO wallets (id, name, currency, initial_balance, system, allow_negative, is_active)
            VALUES (:id, :name, :currency, :initialBalance, :system, :allowNegative, :active)
            ON CONFLICT(id) DO UPDATE SET
                name = excluded.name,
                currency = excluded.currency,
                initial_balance = excluded.initial_balance,
                system = excluded.system,
                allow_negative = excluded.allow_negative,
                is_active = excluded.is_active
            """;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", wallet.getId())
            .addValue("name", wallet.getName())
            .addValue("currency", wallet.getCurrency())
            .addValue("initialBalance", wallet.getInitialBalance())
            .addValue("system", wallet.isSystem() ? 1 : 0)
            .addValue("allowNegative", wallet.isAllowNegative() ? 1 : 0)
            .addValue("active", wallet.isActive() ? 1 : 0);
        query(() -> db.jdbc().update(sql, params));
    }

    @Override
    public Wallet getSystemWallet() {
        List<Wallet> wallets = query(() -> jdbc().query(
            "SELECT " + SqliteRows.WALLET_COLUMNS + " FROM wallets WHERE system = 1 OR id = ? "
                + "ORDER BY system DESC, id LIMIT 1",
            SqliteRows.WALLET, Wallet.SYSTEM_WALLET_ID));
        return wallets.isEmpty() ? Wallet.systemDefault(0.0) : wallets.get(0);
    }

    @Override
    public void saveInitialBalance(double balance) {
        saveWallet(getSystemWallet().toBuilder().initialBalance(balance).build());
    }

    @Override
    public double loadInitialBalance() {
        return getSystemWallet().getInitialBalance();
    }

    // Records

    @Override
    public List<LedgerRecord> loadAll() {
        return loadRecordsAndTransfers().getRecords();
    }

    @Override
    public Optional<LedgerRecord> getById(long recordId) {
        return loadAll().stream().filter(r -> r.getId() == recordId).findFirst();
    }

    @Override
    public LedgerRecord save(LedgerRecord record) {
        LedgerRecord stored = query(() -> db.inTransaction(status -> {
            LedgerRecord candidate = record;
            if (candidate.getId() <= 0 || exists("records", candidate.getId())) {
                Long maxId = jdbc().queryForObject("SELECT COALESCE(MAX(id), 0) FROM records", Long.class);
                candidate = candidate.withId((maxId == null ? 0 : maxId) + 1);
            }
            SqliteRows.insertRecord(db, candidate, true);
            validateIntegrity();
            return candidate;
        }));
        log.debug("Saved {} record #{} on wallet {}", stored.getType().getCode(), stored.getId(), stored.getWalletId());
        return stored;
    }

    @Override
    public void replace(LedgerRecord record) {
        if (record.getId() <= 0) {
            throw new ValidationException("Record id must be positive");
        }
        String sql = """
            UPDATE records SET
                type = :type, date = :date, wallet_id = :walletId, transfer_id = :transferId,
                commission_for_transfer_id = :commissionFor, amount_original = :amountOriginal,
                currency = :currency, rate_at_operation = :rate, amount_kzt = :amountKzt,
                category = :category, description = :description, period = :period
            WHERE id = :id
            """;
        MapSqlParameterSource params = SqliteRows.recordParams(record)
            .addValue("type", record.getType().getCode())
            .addValue("transferId", record.getTransferId())
            .addValue("commissionFor", record.getCommissionForTransferId());
        query(() -> db.inTransaction(status -> {
            if (db.jdbc().update(sql, params) == 0) {
                throw RecordNotFoundException.byId(record.getId());
            }
            validateIntegrity();
            return null;
        }));
    }

    @Override
    public void deleteByIndex(int index) {
        List<LedgerRecord> records = loadAll();
        if (index < 0 || index >= records.size()) {
            throw RecordNotFoundException.byIndex(index);
        }
        LedgerRecord target = records.get(index);
        if (target.getTransferId() != null) {
            deleteTransfer(target.getTransferId());
            return;
        }
        query(() -> jdbc().update("DELETE FROM records WHERE id = ?", target.getId()));
    }

    @Override
    public void deleteAll() {
        query(() -> db.inTransaction(status -> {
            jdbc().update("DELETE FROM records");
            jdbc().update("DELETE FROM transfers");
            return null;
        }));
    }

    // Transfers

    @Override
    public List<Transfer> loadTransfers() {
        return loadRecordsAndTransfers().getTransfers();
    }

    @Override
    public void saveTransfer(Transfer transfer) {
        String sql = """
            INSERT INTO transfers (id, from_wallet_id, to_wallet_id, date, amount_original, currency,
                                   rate_at_operation, amount_kzt, description)
            VALUES (:id, :fromWalletId, :toWalletId, :date, :amountOriginal, :currency, :rate, :amountKzt, :description)
            ON CONFLICT(id) DO UPDATE SET
                from_wallet_id = excluded.from_wallet_id,
                to_wallet_id = excluded.to_wallet_id,
                date = excluded.date,
                amount_original = excluded.amount_original,
                currency = excluded.currency,
                rate_at_operation = excluded.rate_at_operation,
                amount_kzt = excluded.amount_kzt,
                description = excluded.description
            """;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", transfer.getId())
            .addValue("fromWalletId", transfer.getFromWalletId())
            .addValue("toWalletId", transfer.getToWalletId())
            .addValue("date", transfer.getDate().toString())
            .addValue("amountOriginal", transfer.getAmountOriginal())
            .addValue("currency", transfer.getCurrency())
            .addValue("rate", transfer.getRateAtOperation())
            .addValue("amountKzt", transfer.getAmountKzt())
            .addValue("description", transfer.getDescription());
        query(() -> db.inTransaction(status -> {
            db.jdbc().update(sql, params);
            validateIntegrity();
            return null;
        }));
    }

    @Override
    public void deleteTransfer(long transferId) {
        query(() -> db.inTransaction(status -> {
            if (!exists("transfers", transferId)) {
                throw new TransferNotFoundException(transferId);
            }
            jdbc().update("DELETE FROM records WHERE transfer_id = ? OR commission_for_transfer_id = ?",
                transferId, transferId);
            jdbc().update("DELETE FROM transfers WHERE id = ?", transferId);
            return null;
        }));
        log.info("Deleted transfer #{} from {}", transferId, db.getPath());
    }

    // Mandatory expense templates

    @Override
    public List<MandatoryExpenseRecord> loadMandatoryExpenses() {
        return query(() -> jdbc().query(
            "SELECT " + SqliteRows.MANDATORY_COLUMNS + " FROM mandatory_expenses ORDER BY id",
            SqliteRows.MANDATORY));
    }

    @Override
    public MandatoryExpenseRecord saveMandatoryExpense(MandatoryExpenseRecord expense) {
        return query(() -> db.inTransaction(status -> {
            MandatoryExpenseRecord candidate = expense;
            if (candidate.getId() <= 0 || exists("mandatory_expenses", candidate.getId())) {
                Long maxId = jdbc().queryForObject("SELECT COALESCE(MAX(id), 0) FROM mandatory_expenses", Long.class);
                candidate = (MandatoryExpenseRecord) candidate.withId((maxId == null ? 0 : maxId) + 1);
            }
            SqliteRows.insertMandatoryExpense(db, candidate, true);
            return candidate;
        }));
    }

    @Override
    public void deleteMandatoryExpenseByIndex(int index) {
        List<MandatoryExpenseRecord> templates = loadMandatoryExpenses();
        if (index < 0 || index >= templates.size()) {
            throw RecordNotFoundException.byIndex(index);
        }
        query(() -> jdbc().update("DELETE FROM mandatory_expenses WHERE id = ?", templates.get(index).getId()));
    }

    @Override
    public void deleteAllMandatoryExpenses() {
        query(() -> jdbc().update("DELETE FROM mandatory_expenses"));
    }

    // Bulk

    @Override
    public void replaceRecordsAndTransfers(List<LedgerRecord> records, List<Transfer> transfers) {
        TransferIntegrity.validate(records, transfers);
        query(() -> db.inTransaction(status -> {
            jdbc().update("DELETE FROM records");
            jdbc().update("DELETE FROM transfers");
            for (Transfer transfer : transfers) {
                SqliteRows.insertTransfer(db, transfer, true);
            }
            for (LedgerRecord record : records) {
                SqliteRows.insertRecord(db, record, true);
            }
            return null;
        }));
        log.info("Replaced records and transfers in {}: {} records, {} transfers",
            db.getPath(), records.size(), transfers.size());
    }

    @Override
    public void replaceAllData(LedgerDataset dataset) {
        TransferIntegrity.validate(dataset.getRecords(), dataset.getTransfers());
        List<Wallet> wallets = dataset.getWallets().isEmpty()
            ? List.of(Wallet.systemDefault(0.0)) : dataset.getWallets();
        query(() -> db.inTransaction(status -> {
            jdbc().update("DELETE FROM records");
            jdbc().update("DELETE FROM mandatory_expenses");
            jdbc().update("DELETE FROM transfers");
            jdbc().update("DELETE FROM wallets");
            for (Wallet wallet : wallets) {
                SqliteRows.insertWallet(db, wallet, true);
            }
            for (Transfer transfer : dataset.getTransfers()) {
                SqliteRows.insertTransfer(db, transfer, true);
            }
            for (LedgerRecord record : dataset.getRecords()) {
                SqliteRows.insertRecord(db, record, true);
            }
            for (MandatoryExpenseRecord template : dataset.getMandatoryExpenses()) {
                SqliteRows.insertMandatoryExpense(db, template, true);
            }
            return null;
        }));
        log.info("Replaced all data in {}: {} wallets, {} records, {} transfers, {} templates",
            db.getPath(), wallets.size(), dataset.getRecords().size(),
            dataset.getTransfers().size(), dataset.getMandatoryExpenses().size());
    }

    @Override
    public LedgerDataset loadDataset() {
        LedgerDataset recordsAndTransfers = loadRecordsAndTransfers();
        return recordsAndTransfers.toBuilder()
            .wallets(loadWallets())
            .mandatoryExpenses(loadMandatoryExpenses())
            .build();
    }

    @Override
    public void close() {
        db.close();
    }

    private LedgerDataset loadRecordsAndTransfers() {
        List<LedgerRecord> records = query(() -> jdbc().query(
            "SELECT " + SqliteRows.RECORD_COLUMNS + " FROM records ORDER BY id", SqliteRows.RECORD));
        List<Transfer> transfers = query(() -> jdbc().query(
            "SELECT " + SqliteRows.TRANSFER_COLUMNS + " FROM transfers ORDER BY id", SqliteRows.TRANSFER));
        TransferIntegrity.validate(records, transfers);
        return LedgerDataset.builder()
            .records(new ArrayList<>(records))
            .transfers(new ArrayList<>(transfers))
            .build();
    }

    private void validateIntegrity() {
        loadRecordsAndTransfers();
    }

    private boolean exists(String table, long id) {
        Integer count = jdbc().queryForObject("SELECT COUNT(*) FROM " + table + " WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    private <T> T query(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException("SQLite operation failed on " + db.getPath() + ": " + e.getMessage(), e);
        }
    }
}
