package com.walletledger.storage;

import com.walletledger.common.exception.TransferNotFoundException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.transfers.Transfer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * In-memory edits of a dataset shared by the stores and the use-case services.
 */
public final class LedgerMutations {

    private LedgerMutations() {
    }

    public static <T> long nextId(Collection<T> items, ToLongFunction<T> idOf) {
        long max = 0;
        for (T item : items) {
            max = Math.max(max, idOf.applyAsLong(item));
        }
        return max + 1;
    }

    /**
     * Ids of records that go away together with a transfer: both legs and its commission.
     */
    public static boolean belongsToTransfer(LedgerRecord record, long transferId) {
        return (record.getTransferId() != null && record.getTransferId() == transferId)
            || (record.getCommissionForTransferId() != null && record.getCommissionForTransferId() == transferId);
    }

    /**
     * Removes a transfer, its legs and its commission record.
     *
     * @throws TransferNotFoundException if the dataset has no such transfer
     */
    public static LedgerDataset removeTransfer(LedgerDataset dataset, long transferId) {
        List<Transfer> transfers = new ArrayList<>(dataset.getTransfers());
        if (!transfers.removeIf(t -> t.getId() == transferId)) {
            throw new TransferNotFoundException(transferId);
        }
        List<LedgerRecord> records = new ArrayList<>(dataset.getRecords());
        records.removeIf(r -> belongsToTransfer(r, transferId));
        return dataset.toBuilder().records(records).transfers(transfers).build();
    }

    /**
     * Appends a record, giving it a fresh id when it has none or its id is already used.
     */
    public static LedgerRecord assignId(LedgerRecord record, Collection<? extends LedgerRecord> existing) {
        boolean taken = existing.stream().anyMatch(r -> r.getId() == record.getId());
        if (record.getId() > 0 && !taken) {
            return record;
        }
        return record.withId(nextId(existing, LedgerRecord::getId));
    }
}
