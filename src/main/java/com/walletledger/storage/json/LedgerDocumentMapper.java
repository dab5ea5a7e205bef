package com.walletledger.storage.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.LedgerDates;
import com.walletledger.common.exception.ValidationException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.MandatoryExpenseRecord;
import com.walletledger.records.MandatoryPeriod;
import com.walletledger.records.RecordType;
import com.walletledger.storage.LedgerDataset;
import com.walletledger.transfers.Transfer;
import com.walletledger.wallets.Wallet;
import lombok.RequiredArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the JSON document and the domain dataset.
 *
 * Legacy documents, either a bare array of records or an object without a
 * {@code wallets} key, are upgraded while reading: their top-level
 * {@code initial_balance} moves to a system wallet with id 1, records get wallet 1
 * and sequential ids where missing, and a bare {@code amount} becomes a base currency amount.
 */
@RequiredArgsConstructor
class LedgerDocumentMapper {

    private final ObjectMapper objectMapper;

    @Value
    static class ReadResult {
        LedgerDataset dataset;
        boolean upgraded;
    }

    ReadResult read(JsonNode root) throws JsonProcessingException {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new ReadResult(upgradeLegacy(objectMapper.createArrayNode(), null, null, null, 0.0), true);
        }
        if (root.isArray()) {
            return new ReadResult(upgradeLegacy((ArrayNode) root, null, null, null, 0.0), true);
        }
        if (!root.isObject()) {
            throw new ValidationException("Unexpected JSON root: " + root.getNodeType());
        }
        if (!root.has("wallets")) {
            double initialBalance = root.path("initial_balance").asDouble(0.0);
            return new ReadResult(upgradeLegacy(root.get("records"), root.get("transfers"),
                root.get("mandatory_expenses"), null, initialBalance), true);
        }
        LedgerDocument document = objectMapper.treeToValue(root, LedgerDocument.class);
        return new ReadResult(toDataset(document), false);
    }

    private LedgerDataset upgradeLegacy(JsonNode records, JsonNode transfers, JsonNode mandatory,
                                        JsonNode wallets, double initialBalance) throws JsonProcessingException {
        LedgerDocument document = new LedgerDocument();
        document.setRecords(readList(records, RecordDocument.class));
        document.setTransfers(readList(transfers, TransferDocument.class));
        document.setMandatoryExpenses(readList(mandatory, RecordDocument.class));
        document.setWallets(readList(wallets, WalletDocument.class));
        LedgerDataset dataset = toDataset(document);
        if (dataset.getWallets().isEmpty()) {
            dataset = dataset.toBuilder().wallets(List.of(Wallet.systemDefault(initialBalance))).build();
        }
        return dataset;
    }

    private <T> List<T> readList(JsonNode node, Class<T> type) throws JsonProcessingException {
        List<T> items = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return items;
        }
        for (JsonNode item : node) {
            items.add(objectMapper.treeToValue(item, type));
        }
        return items;
    }

    LedgerDataset toDataset(LedgerDocument document) {
        List<Wallet> wallets = new ArrayList<>();
        long nextWalletId = maxId(document.getWallets().stream().map(WalletDocument::getId).toList()) + 1;
        for (WalletDocument doc : document.getWallets()) {
            long id = doc.getId() != null && doc.getId() > 0 ? doc.getId() : nextWalletId++;
            wallets.add(Wallet.builder()
                .id(id)
                .name(doc.getName())
                .currency(doc.getCurrency() == null ? CurrencyCodes.BASE : doc.getCurrency())
                .initialBalance(doc.getInitialBalance() == null ? 0.0 : doc.getInitialBalance())
                .system(Boolean.TRUE.equals(doc.getSystem()))
                .allowNegative(Boolean.TRUE.equals(doc.getAllowNegative()))
                .active(doc.getActive() == null || doc.getActive())
                .build());
        }

        List<Transfer> transfers = new ArrayList<>();
        for (TransferDocument doc : document.getTransfers()) {
            transfers.add(Transfer.builder()
                .id(doc.getId() == null ? 0 : doc.getId())
                .fromWalletId(doc.getFromWalletId() == null ? 0 : doc.getFromWalletId())
                .toWalletId(doc.getToWalletId() == null ? 0 : doc.getToWalletId())
                .date(LedgerDates.parse(doc.getDate()))
                .amountOriginal(orZero(doc.getAmountOriginal()))
                .currency(doc.getCurrency() == null ? CurrencyCodes.BASE : doc.getCurrency())
                .amountKzt(orZero(doc.getAmountKzt()))
                .description(doc.getDescription())
                .build());
        }

        List<LedgerRecord> records = toRecords(document.getRecords(), false);
        List<MandatoryExpenseRecord> mandatory = new ArrayList<>();
        for (LedgerRecord template : toRecords(document.getMandatoryExpenses(), true)) {
            mandatory.add((MandatoryExpenseRecord) template);
        }

        return LedgerDataset.builder()
            .wallets(wallets)
            .records(records)
            .transfers(transfers)
            .mandatoryExpenses(mandatory)
            .build();
    }

    private List<LedgerRecord> toRecords(List<RecordDocument> documents, boolean templates) {
        List<LedgerRecord> records = new ArrayList<>();
        long nextId = maxId(documents.stream().map(RecordDocument::getId).toList()) + 1;
        for (RecordDocument doc : documents) {
            long id = doc.getId() != null && doc.getId() > 0 ? doc.getId() : nextId++;
            records.add(toRecord(doc, id, templates));
        }
        return records;
    }

    private LedgerRecord toRecord(RecordDocument doc, long id, boolean template) {
        RecordType type = template ? RecordType.MANDATORY_EXPENSE : RecordType.fromCode(doc.getType());
        LocalDate date = doc.getDate() == null || doc.getDate().isBlank()
            ? null : LedgerDates.parse(doc.getDate());

        String currency = doc.getCurrency() == null ? CurrencyCodes.BASE : doc.getCurrency();
        double amountOriginal;
        double amountKzt;
        if (doc.getAmountOriginal() == null && doc.getAmount() != null) {
            currency = CurrencyCodes.BASE;
            amountOriginal = Math.abs(doc.getAmount());
            amountKzt = amountOriginal;
        } else {
            amountOriginal = Math.abs(orZero(doc.getAmountOriginal()));
            if (doc.getAmountKzt() != null) {
                amountKzt = doc.getAmountKzt();
            } else if (doc.getRateAtOperation() != null) {
                amountKzt = amountOriginal * doc.getRateAtOperation();
            } else {
                amountKzt = amountOriginal;
            }
        }

        return LedgerRecord.builder()
            .type(type)
            .id(id)
            .date(date)
            .walletId(doc.getWalletId() == null ? Wallet.SYSTEM_WALLET_ID : doc.getWalletId())
            .transferId(doc.getTransferId())
            .commissionForTransferId(doc.getCommissionForTransferId())
            .amountOriginal(amountOriginal)
            .currency(currency)
            .amountKzt(amountKzt)
            .category(doc.getCategory())
            .description(doc.getDescription())
            .period(type == RecordType.MANDATORY_EXPENSE
                ? MandatoryPeriod.fromCode(doc.getPeriod() == null ? "monthly" : doc.getPeriod()) : null)
            .build();
    }

    LedgerDocument toDocument(LedgerDataset dataset) {
        LedgerDocument document = new LedgerDocument();
        for (Wallet wallet : dataset.getWallets()) {
            document.getWallets().add(WalletDocument.builder()
                .id(wallet.getId())
                .name(wallet.getName())
                .currency(wallet.getCurrency())
                .initialBalance(wallet.getInitialBalance())
                .system(wallet.isSystem())
                .allowNegative(wallet.isAllowNegative())
                .active(wallet.isActive())
                .build());
        }
        for (LedgerRecord record : dataset.getRecords()) {
            document.getRecords().add(toDocument(record));
        }
        for (MandatoryExpenseRecord template : dataset.getMandatoryExpenses()) {
            document.getMandatoryExpenses().add(toDocument(template));
        }
        for (Transfer transfer : dataset.getTransfers()) {
            document.getTransfers().add(TransferDocument.builder()
                .id(transfer.getId())
                .fromWalletId(transfer.getFromWalletId())
                .toWalletId(transfer.getToWalletId())
                .date(LedgerDates.format(transfer.getDate()))
                .amountOriginal(transfer.getAmountOriginal())
                .currency(transfer.getCurrency())
                .rateAtOperation(transfer.getRateAtOperation())
                .amountKzt(transfer.getAmountKzt())
                .description(transfer.getDescription())
                .build());
        }
        return document;
    }

    private RecordDocument toDocument(LedgerRecord record) {
        return RecordDocument.builder()
            .id(record.getId())
            .type(record.getType().getCode())
            .date(LedgerDates.format(record.getDate()))
            .walletId(record.getWalletId())
            .transferId(record.getTransferId())
            .commissionForTransferId(record.getCommissionForTransferId())
            .amountOriginal(record.getAmountOriginal())
            .currency(record.getCurrency())
            .rateAtOperation(record.getRateAtOperation())
            .amountKzt(record.getAmountKzt())
            .category(record.getCategory())
            .description(record.getDescription())
            .period(record instanceof MandatoryExpenseRecord
                ? ((MandatoryExpenseRecord) record).getPeriod().getCode() : null)
            .build();
    }

    private static long maxId(List<Long> ids) {
        long max = 0;
        for (Long id : ids) {
            if (id != null && id > max) {
                max = id;
            }
        }
        return max;
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
