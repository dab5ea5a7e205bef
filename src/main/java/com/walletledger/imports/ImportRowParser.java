package com.walletledger.imports;

import com.walletledger.common.Amounts;
import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.LedgerDates;
import com.walletledger.common.exception.LedgerException;
import com.walletledger.currency.CurrencyRateProvider;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryPeriod;
import com.walletledger.records.RecordType;
import com.walletledger.transfers.Transfer;
import com.walletledger.wallets.Wallet;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns loosely-typed rows into ledger records.
 *
 * A bad row never makes the parser throw: every problem is reported as an error message
 * prefixed with the row label, so a batch can collect all of them.
 */
public class ImportRowParser {

    public static final String INITIAL_BALANCE_TYPE = "initial_balance";
    public static final String TRANSFER_TYPE = "transfer";
    public static final String DEFAULT_TRANSFER_CATEGORY = "Transfer";

    private static final Set<String> MANDATORY_ALIASES = Set.of(
        "mandatory", "mandatoryexpense", "mandatory_expenses", "mandatory_expense_record");

    private final CurrencyRateProvider rateProvider;

    /**
     * @param rateProvider rate lookup for {@link ImportPolicy#CURRENT_RATE}, may be {@code null}
     */
    public ImportRowParser(CurrencyRateProvider rateProvider) {
        this.rateProvider = rateProvider;
    }

    /**
     * Raised inside the parser for a row that cannot be accepted.
     */
    private static class RowRejectedException extends Exception {
        RowRejectedException(String message) {
            super(message);
        }
    }

    private static final class RowAmounts {
        double amountOriginal;
        String currency;
        double amountKzt;
    }

    public static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    public static Map<String, String> normalize(Map<String, ?> row) {
        Map<String, String> normalized = new LinkedHashMap<>();
        row.forEach((key, value) -> {
            if (key != null) {
                normalized.put(normalizeKey(key), value == null ? "" : String.valueOf(value).trim());
            }
        });
        return normalized;
    }

    public static String rowType(Map<String, String> row) {
        String type = normalizeKey(row.getOrDefault("type", ""));
        return MANDATORY_ALIASES.contains(type) ? RecordType.MANDATORY_EXPENSE.getCode() : type;
    }

    public static boolean isBlank(Map<String, String> row) {
        return row.values().stream().allMatch(String::isBlank);
    }

    /**
     * Reads a number, treating {@code (12.5)} as {@code -12.5}.
     *
     * @return the value, or {@code null} when the text is not a number
     */
    static Double parseNumber(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String raw = text.trim();
        if (raw.startsWith("(") && raw.endsWith(")")) {
            raw = "-" + raw.substring(1, raw.length() - 1);
        }
        try {
            double value = Double.parseDouble(raw);
            return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public ParsedRow parse(Map<String, ?> rawRow, String rowLabel, ImportPolicy policy, boolean mandatoryOnly) {
        Map<String, String> row = normalize(rawRow);
        String type = rowType(row);

        if (INITIAL_BALANCE_TYPE.equals(type)) {
            Double balance = parseNumber(firstPresent(row, "amount_original", "amount_kzt", "amount"));
            return ParsedRow.initialBalance(balance == null ? 0.0 : balance);
        }
        try {
            return ParsedRow.record(parseRecord(row, rowLabel, type, policy, mandatoryOnly));
        } catch (RowRejectedException e) {
            return ParsedRow.error(e.getMessage());
        }
    }

    private LedgerRecord parseRecord(Map<String, String> row, String rowLabel, String type,
                                     ImportPolicy policy, boolean mandatoryOnly) throws RowRejectedException {
        List<String> required = new ArrayList<>(List.of("category"));
        if (!mandatoryOnly) {
            required.add("type");
            required.add("date");
        }
        if (policy == ImportPolicy.LEGACY) {
            required.add("amount");
        } else {
            required.add("amount_original");
            required.add("currency");
        }
        for (String field : required) {
            if (row.getOrDefault(field, "").isBlank()) {
                throw new RowRejectedException(rowLabel + ": missing required field '" + field + "'");
            }
        }

        String dateValue = row.getOrDefault("date", "");
        LocalDate date = dateValue.isBlank() ? null : parseDate(dateValue, rowLabel);

        RecordType recordType;
        if (mandatoryOnly) {
            recordType = RecordType.MANDATORY_EXPENSE;
        } else {
            try {
                recordType = RecordType.fromCode(type);
            } catch (LedgerException e) {
                throw new RowRejectedException(rowLabel + ": unsupported type '" + type + "'");
            }
        }

        RowAmounts amounts = parseAmounts(row, rowLabel, policy);

        MandatoryPeriod period = null;
        if (recordType == RecordType.MANDATORY_EXPENSE) {
            String periodValue = row.getOrDefault("period", "");
            try {
                period = MandatoryPeriod.fromCode(periodValue.isBlank() ? "monthly" : periodValue);
            } catch (LedgerException e) {
                throw new RowRejectedException(rowLabel + ": invalid mandatory period '" + periodValue + "'");
            }
        }

        try {
            return LedgerRecord.builder()
                .type(recordType)
                .date(date)
                .walletId(parseId(row, "wallet_id", rowLabel, Wallet.SYSTEM_WALLET_ID))
                .transferId(parseId(row, "transfer_id", rowLabel, null))
                .commissionForTransferId(parseId(row, "commission_for_transfer_id", rowLabel, null))
                .amountOriginal(amounts.amountOriginal)
                .currency(amounts.currency)
                .amountKzt(amounts.amountKzt)
                .category(row.get("category"))
                .description(row.getOrDefault("description", ""))
                .period(period)
                .build();
        } catch (LedgerException e) {
            throw new RowRejectedException(rowLabel + ": " + e.getMessage());
        }
    }

    /**
     * Parses a compact {@code transfer} row into a transfer with its two legs.
     *
     * @param transferId id to use when the row has no {@code transfer_id}
     * @param walletIds known wallets, or {@code null} to skip the check
     */
    public ParsedTransfer parseTransfer(Map<String, ?> rawRow, String rowLabel, ImportPolicy policy,
                                        long transferId, Set<Long> walletIds) {
        try {
            return parseTransferRow(normalize(rawRow), rowLabel, policy, transferId, walletIds);
        } catch (RowRejectedException e) {
            return ParsedTransfer.error(e.getMessage());
        }
    }

    private ParsedTransfer parseTransferRow(Map<String, String> row, String rowLabel, ImportPolicy policy,
                                            long transferId, Set<Long> walletIds) throws RowRejectedException {
        String dateValue = row.getOrDefault("date", "");
        if (dateValue.isBlank()) {
            throw new RowRejectedException(rowLabel + ": missing required field 'date'");
        }
        LocalDate date = parseDate(dateValue, rowLabel);

        Long from = parseId(row, "from_wallet_id", rowLabel, null);
        Long to = parseId(row, "to_wallet_id", rowLabel, null);
        if (from == null || to == null) {
            throw new RowRejectedException(rowLabel + ": invalid transfer wallets (from_wallet_id/to_wallet_id)");
        }
        long fromWalletId = from;
        long toWalletId = to;
        if (fromWalletId == toWalletId) {
            throw new RowRejectedException(rowLabel + ": transfer wallets must be different");
        }
        if (walletIds != null) {
            for (long walletId : new long[] {fromWalletId, toWalletId}) {
                if (!walletIds.contains(walletId)) {
                    throw new RowRejectedException(rowLabel + ": wallet not found (" + walletId + ")");
                }
            }
        }

        RowAmounts amounts = parseAmounts(row, rowLabel, policy);

        long id = parseId(row, "transfer_id", rowLabel, transferId);
        String category = row.getOrDefault("category", "");
        if (category.isBlank()) {
            category = DEFAULT_TRANSFER_CATEGORY;
        }

        Transfer transfer;
        try {
            transfer = Transfer.builder()
                .id(id)
                .fromWalletId(fromWalletId)
                .toWalletId(toWalletId)
                .date(date)
                .amountOriginal(amounts.amountOriginal)
                .currency(amounts.currency)
                .amountKzt(amounts.amountKzt)
                .description(row.getOrDefault("description", ""))
                .build();
        } catch (LedgerException e) {
            throw new RowRejectedException(rowLabel + ": invalid transfer (" + e.getMessage() + ")");
        }
        LedgerRecord expense = leg(RecordType.EXPENSE, transfer, fromWalletId, category);
        LedgerRecord income = leg(RecordType.INCOME, transfer, toWalletId, category);
        String mismatch = legMismatch(expense, income);
        if (mismatch != null) {
            throw new RowRejectedException(rowLabel + ": " + mismatch);
        }
        return ParsedTransfer.of(transfer, expense, income);
    }

    /**
     * Names the first field two legs of one transfer disagree on, or returns {@code null}.
     */
    public static String legMismatch(LedgerRecord expense, LedgerRecord income) {
        if (!Amounts.equal(expense.getAmountOriginal(), income.getAmountOriginal())) {
            return "linked records amount_original mismatch";
        }
        if (!expense.getCurrency().equals(income.getCurrency())) {
            return "linked records currency mismatch";
        }
        if (Math.abs(expense.getRateAtOperation() - income.getRateAtOperation()) > 1e-6) {
            return "linked records rate_at_operation mismatch";
        }
        return null;
    }

    private static LedgerRecord leg(RecordType type, Transfer transfer, long walletId, String category) {
        return LedgerRecord.builder()
            .type(type)
            .date(transfer.getDate())
            .walletId(walletId)
            .transferId(transfer.getId())
            .amountOriginal(transfer.getAmountOriginal())
            .currency(transfer.getCurrency())
            .amountKzt(transfer.getAmountKzt())
            .category(category)
            .description(transfer.getDescription())
            .build();
    }

    private RowAmounts parseAmounts(Map<String, String> row, String rowLabel, ImportPolicy policy)
            throws RowRejectedException {
        RowAmounts amounts = new RowAmounts();
        if (policy == ImportPolicy.LEGACY) {
            Double amount = parseNumber(row.get("amount"));
            if (amount == null) {
                throw new RowRejectedException(rowLabel + ": invalid amount");
            }
            amounts.amountOriginal = Math.abs(amount);
            amounts.currency = CurrencyCodes.BASE;
            amounts.amountKzt = Math.abs(amount);
            return amounts;
        }

        Double amountOriginal = parseNumber(row.get("amount_original"));
        if (amountOriginal == null) {
            throw new RowRejectedException(rowLabel + ": invalid amount_original");
        }
        String currency = row.getOrDefault("currency", "").trim().toUpperCase(Locale.ROOT);
        if (!CurrencyCodes.isValid(currency)) {
            throw new RowRejectedException(rowLabel + ": invalid currency '" + currency + "'");
        }
        if (amountOriginal < 0) {
            throw new RowRejectedException(rowLabel + ": amount_original must be >= 0");
        }

        double amountKzt;
        if (policy == ImportPolicy.CURRENT_RATE) {
            if (rateProvider == null) {
                throw new RowRejectedException(rowLabel + ": current-rate policy requires currency service");
            }
            try {
                amountKzt = Amounts.round2(amountOriginal * rateProvider.getRate(currency));
            } catch (LedgerException e) {
                throw new RowRejectedException(
                    rowLabel + ": failed to get current rate for " + currency + " (" + e.getMessage() + ")");
            }
        } else {
            requireNumber(row, "rate_at_operation", rowLabel);
            amountKzt = requireNumber(row, "amount_kzt", rowLabel);
        }

        amounts.amountOriginal = amountOriginal;
        amounts.currency = currency;
        amounts.amountKzt = Math.abs(amountKzt);
        return amounts;
    }

    private static double requireNumber(Map<String, String> row, String field, String rowLabel)
            throws RowRejectedException {
        String value = row.getOrDefault(field, "");
        if (value.isBlank()) {
            throw new RowRejectedException(rowLabel + ": missing required field '" + field + "'");
        }
        Double number = parseNumber(value);
        if (number == null) {
            throw new RowRejectedException(rowLabel + ": invalid " + field + " '" + value + "'");
        }
        return number;
    }

    private static LocalDate parseDate(String value, String rowLabel) throws RowRejectedException {
        try {
            return LedgerDates.parse(value);
        } catch (LedgerException e) {
            throw new RowRejectedException(rowLabel + ": invalid date '" + value + "' (" + e.getMessage() + ")");
        }
    }

    private static Long parseId(Map<String, String> row, String field, String rowLabel, Long defaultValue)
            throws RowRejectedException {
        String value = row.getOrDefault(field, "");
        if (value.isBlank()) {
            return defaultValue;
        }
        Double number = parseNumber(value);
        if (number == null || number <= 0 || number != Math.rint(number)) {
            throw new RowRejectedException(rowLabel + ": invalid " + field + " '" + value + "'");
        }
        return number.longValue();
    }

    private static String firstPresent(Map<String, String> row, String... fields) {
        for (String field : fields) {
            String value = row.get(field);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
