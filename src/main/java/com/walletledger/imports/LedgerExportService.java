package com.walletledger.imports;

import com.walletledger.common.LedgerDates;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.records.RecordType;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.storage.LedgerRepository;
import com.walletledger.transfers.Transfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports the ledger as rows in the format {@link LedgerImportService} reads back
 * with {@link ImportPolicy#FULL_BACKUP}.
 *
 * Transfer legs are not exported one by one: each transfer becomes a single
 * {@code transfer} row that the importer expands into its two legs again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerExportService {

    public static final List<String> DATA_HEADERS = List.of(
        "date", "type", "wallet_id", "category", "amount_original", "currency", "rate_at_operation",
        "amount_kzt", "description", "period", "transfer_id", "from_wallet_id", "to_wallet_id",
        "commission_for_transfer_id");

    public static final List<String> MANDATORY_HEADERS = List.of(
        "type", "wallet_id", "category", "amount_original", "currency", "rate_at_operation",
        "amount_kzt", "description", "period");

    private final LedgerRepository repository;

    public List<Map<String, String>> exportRows() {
        LedgerDataset dataset = repository.loadDataset();
        List<Map<String, String>> rows = new ArrayList<>();

        Map<String, String> balanceRow = emptyRow(DATA_HEADERS);
        balanceRow.put("type", ImportRowParser.INITIAL_BALANCE_TYPE);
        balanceRow.put("amount_original", number(dataset.systemWallet().getInitialBalance()));
        rows.add(balanceRow);

        Map<Long, String> legCategories = new HashMap<>();
        for (LedgerRecord record : dataset.getRecords()) {
            if (record.isTransferLeg()) {
                if (record.getType() == RecordType.EXPENSE) {
                    legCategories.put(record.getTransferId(), record.getCategory());
                }
                continue;
            }
            Map<String, String> row = recordRow(record, DATA_HEADERS);
            row.put("date", LedgerDates.format(record.getDate()));
            row.put("type", record.getType().getCode());
            if (record.getCommissionForTransferId() != null) {
                row.put("commission_for_transfer_id", String.valueOf(record.getCommissionForTransferId()));
            }
            rows.add(row);
        }

        for (Transfer transfer : dataset.getTransfers()) {
            Map<String, String> row = emptyRow(DATA_HEADERS);
            row.put("date", LedgerDates.format(transfer.getDate()));
            row.put("type", ImportRowParser.TRANSFER_TYPE);
            row.put("category",
                legCategories.getOrDefault(transfer.getId(), ImportRowParser.DEFAULT_TRANSFER_CATEGORY));
            row.put("amount_original", number(transfer.getAmountOriginal()));
            row.put("currency", transfer.getCurrency());
            row.put("rate_at_operation", number(transfer.getRateAtOperation()));
            row.put("amount_kzt", number(transfer.getAmountKzt()));
            row.put("description", transfer.getDescription());
            row.put("transfer_id", String.valueOf(transfer.getId()));
            row.put("from_wallet_id", String.valueOf(transfer.getFromWalletId()));
            row.put("to_wallet_id", String.valueOf(transfer.getToWalletId()));
            rows.add(row);
        }
        log.info("Exported {} rows ({} transfers)", rows.size(), dataset.getTransfers().size());
        return rows;
    }

    public List<Map<String, String>> exportMandatoryRows() {
        List<Map<String, String>> rows = new ArrayList<>();
        for (MandatoryExpenseRecord template : repository.loadMandatoryExpenses()) {
            Map<String, String> row = recordRow(template, MANDATORY_HEADERS);
            row.put("type", template.getType().getCode());
            rows.add(row);
        }
        return rows;
    }

    private static Map<String, String> recordRow(LedgerRecord record, List<String> headers) {
        Map<String, String> row = emptyRow(headers);
        row.put("wallet_id", String.valueOf(record.getWalletId()));
        row.put("category", record.getCategory());
        row.put("amount_original", number(record.getAmountOriginal()));
        row.put("currency", record.getCurrency());
        row.put("rate_at_operation", number(record.getRateAtOperation()));
        row.put("amount_kzt", number(record.getAmountKzt()));
        row.put("description", record.getDescription());
        if (record instanceof MandatoryExpenseRecord) {
            row.put("period", ((MandatoryExpenseRecord) record).getPeriod().getCode());
        }
        return row;
    }

    private static Map<String, String> emptyRow(List<String> headers) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String header : headers) {
            row.put(header, "");
        }
        return row;
    }

    private static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
