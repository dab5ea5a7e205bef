package com.walletledger.storage.sqlite;

import com.walletledger.common.LedgerDates;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.records.MandatoryPeriod;
import com.walletledger.records.RecordType;
import com.walletledger.transfers.Transfer;
import com.walletledger.wallets.Wallet;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Row mappers and insert statements for the ledger tables.
 *
 * Inserts come in two forms: with an explicit id, used when ids are kept, and without,
 * letting SQLite assign the next rowid.
 */
public final class SqliteRows {

    static final String WALLET_COLUMNS =
        "id, name, currency, initial_balance, system, allow_negative, is_active";
    static final String TRANSFER_COLUMNS =
        "id, from_wallet_id, to_wallet_id, date, amount_original, currency, rate_at_operation, amount_kzt, description";
    static final String RECORD_COLUMNS =
        "id, type, date, wallet_id, transfer_id, commission_for_transfer_id, amount_original, currency, "
            + "rate_at_operation, amount_kzt, category, description, period";
    static final String MANDATORY_COLUMNS =
        "id, date, wallet_id, amount_original, currency, rate_at_operation, amount_kzt, category, description, period";

    public static final RowMapper<Wallet> WALLET = (rs, rowNum) -> Wallet.builder()
        .id(rs.getLong("id"))
        .name(rs.getString("name"))
        .currency(rs.getString("currency"))
        .initialBalance(rs.getDouble("initial_balance"))
        .system(rs.getInt("system") == 1)
        .allowNegative(rs.getInt("allow_negative") == 1)
        .active(rs.getInt("is_active") == 1)
        .build();

    public static final RowMapper<Transfer> TRANSFER = (rs, rowNum) -> Transfer.builder()
        .id(rs.getLong("id"))
        .fromWalletId(rs.getLong("from_wallet_id"))
        .toWalletId(rs.getLong("to_wallet_id"))
        .date(LedgerDates.parse(rs.getString("date")))
        .amountOriginal(rs.getDouble("amount_original"))
        .currency(rs.getString("currency"))
        .amountKzt(rs.getDouble("amount_kzt"))
        .description(rs.getString("description"))
        .build();

    public static final RowMapper<LedgerRecord> RECORD = (rs, rowNum) -> {
        RecordType type = RecordType.fromCode(rs.getString("type"));
        String period = rs.getString("period");
        return LedgerRecord.builder()
            .type(type)
            .id(rs.getLong("id"))
            .date(LedgerDates.parse(rs.getString("date")))
            .walletId(rs.getLong("wallet_id"))
            .transferId(nullableLong(rs, "transfer_id"))
            .commissionForTransferId(nullableLong(rs, "commission_for_transfer_id"))
            .amountOriginal(rs.getDouble("amount_original"))
            .currency(rs.getString("currency"))
            .amountKzt(rs.getDouble("amount_kzt"))
            .category(rs.getString("category"))
            .description(rs.getString("description"))
            .period(type == RecordType.MANDATORY_EXPENSE
                ? MandatoryPeriod.fromCode(period == null ? "monthly" : period) : null)
            .build();
    };

    public static final RowMapper<MandatoryExpenseRecord> MANDATORY = (rs, rowNum) -> {
        String date = rs.getString("date");
        return (MandatoryExpenseRecord) LedgerRecord.builder()
            .type(RecordType.MANDATORY_EXPENSE)
            .id(rs.getLong("id"))
            .date(date == null || date.isBlank() ? null : LedgerDates.parse(date))
            .walletId(rs.getLong("wallet_id"))
            .amountOriginal(rs.getDouble("amount_original"))
            .currency(rs.getString("currency"))
            .amountKzt(rs.getDouble("amount_kzt"))
            .category(rs.getString("category"))
            .description(rs.getString("description"))
            .period(MandatoryPeriod.fromCode(rs.getString("period")))
            .build();
    };

    private SqliteRows() {
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Insert a wallet and return its id.
     */
    public static long insertWallet(SqliteDatabase db, Wallet wallet, boolean keepId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", wallet.getId())
            .addValue("name", wallet.getName())
            .addValue("currency", wallet.getCurrency())
            .addValue("initialBalance", wallet.getInitialBalance())
            .addValue("system", wallet.isSystem() ? 1 : 0)
            .addValue("allowNegative", wallet.isAllowNegative() ? 1 : 0)
            .addValue("active", wallet.isActive() ? 1 : 0);
        return insert(db, "wallets", keepId,
            "name, currency, initial_balance, system, allow_negative, is_active",
            ":name, :currency, :initialBalance, :system, :allowNegative, :active", params);
    }

    public static long insertTransfer(SqliteDatabase db, Transfer transfer, boolean keepId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", transfer.getId())
            .addValue("fromWalletId", transfer.getFromWalletId())
            .addValue("toWalletId", transfer.getToWalletId())
            .addValue("date", LedgerDates.format(transfer.getDate()))
            .addValue("amountOriginal", transfer.getAmountOriginal())
            .addValue("currency", transfer.getCurrency())
            .addValue("rate", transfer.getRateAtOperation())
            .addValue("amountKzt", transfer.getAmountKzt())
            .addValue("description", transfer.getDescription());
        return insert(db, "transfers", keepId,
            "from_wallet_id, to_wallet_id, date, amount_original, currency, rate_at_operation, amount_kzt, description",
            ":fromWalletId, :toWalletId, :date, :amountOriginal, :currency, :rate, :amountKzt, :description",
            params);
    }

    public static long insertRecord(SqliteDatabase db, LedgerRecord record, boolean keepId) {
        MapSqlParameterSource params = recordParams(record)
            .addValue("type", record.getType().getCode())
            .addValue("transferId", record.getTransferId())
            .addValue("commissionFor", record.getCommissionForTransferId());
        return insert(db, "records", keepId,
            "type, date, wallet_id, transfer_id, commission_for_transfer_id, amount_original, currency, "
                + "rate_at_operation, amount_kzt, category, description, period",
            ":type, :date, :walletId, :transferId, :commissionFor, :amountOriginal, :currency, "
                + ":rate, :amountKzt, :category, :description, :period",
            params);
    }

    public static long insertMandatoryExpense(SqliteDatabase db, MandatoryExpenseRecord template, boolean keepId) {
        return insert(db, "mandatory_expenses", keepId,
            "date, wallet_id, amount_original, currency, rate_at_operation, amount_kzt, category, description, period",
            ":date, :walletId, :amountOriginal, :currency, :rate, :amountKzt, :category, :description, :period",
            recordParams(template));
    }

    static MapSqlParameterSource recordParams(LedgerRecord record) {
        return new MapSqlParameterSource()
            .addValue("id", record.getId())
            .addValue("date", LedgerDates.format(record.getDate()))
            .addValue("walletId", record.getWalletId())
            .addValue("amountOriginal", record.getAmountOriginal())
            .addValue("currency", record.getCurrency())
            .addValue("rate", record.getRateAtOperation())
            .addValue("amountKzt", record.getAmountKzt())
            .addValue("category", record.getCategory())
            .addValue("description", record.getDescription())
            .addValue("period", record instanceof MandatoryExpenseRecord
                ? ((MandatoryExpenseRecord) record).getPeriod().getCode() : null);
    }

    private static long insert(SqliteDatabase db, String table, boolean keepId, String columns,
                               String values, MapSqlParameterSource params) {
        String sql = keepId
            ? "INSERT INTO " + table + " (id, " + columns + ") VALUES (:id, " + values + ")"
            : "INSERT INTO " + table + " (" + columns + ") VALUES (" + values + ")";
        db.jdbc().update(sql, params);
        return keepId ? (Long) params.getValue("id") : db.lastInsertId();
    }
}
