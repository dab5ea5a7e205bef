package com.walletledger.transfers;

import com.walletledger.common.exception.BrokenTransferPairException;
import com.walletledger.common.exception.DanglingTransferLinkException;
import com.walletledger.records.LedgerRecord;
import com.walletledger.records.RecordType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Double-entry checks for transfers.
 *
 * Every transfer must be backed by one expense and one income record carrying its id,
 * and no record may point at a transfer that does not exist. Run on every load and
 * before every bulk write of both stores.
 */
public final class TransferIntegrity {

    private static final Set<RecordType> PAIR_TYPES = EnumSet.of(RecordType.INCOME, RecordType.EXPENSE);

    private TransferIntegrity() {
    }

    public static void validate(Collection<? extends LedgerRecord> records, Collection<Transfer> transfers) {
        Set<Long> transferIds = new HashSet<>();
        for (Transfer transfer : transfers) {
            transferIds.add(transfer.getId());
        }

        Map<Long, List<LedgerRecord>> linked = new HashMap<>();
        for (LedgerRecord record : records) {
            Long transferId = record.getTransferId();
            if (transferId != null) {
                if (!transferIds.contains(transferId)) {
                    throw new DanglingTransferLinkException(record.getId(), transferId);
                }
                linked.computeIfAbsent(transferId, id -> new ArrayList<>()).add(record);
            }
            Long commissionFor = record.getCommissionForTransferId();
            if (commissionFor != null && !transferIds.contains(commissionFor)) {
                throw new DanglingTransferLinkException(record.getId(), commissionFor);
            }
        }

        for (Transfer transfer : transfers) {
            List<LedgerRecord> legs = linked.getOrDefault(transfer.getId(), List.of());
            if (legs.size() != 2) {
                throw new BrokenTransferPairException(transfer.getId(), legs.size() + " linked records");
            }
            Set<RecordType> types = EnumSet.noneOf(RecordType.class);
            for (LedgerRecord leg : legs) {
                types.add(leg.getType());
            }
            if (!types.equals(PAIR_TYPES)) {
                throw new BrokenTransferPairException(transfer.getId(), "invalid record types " + types);
            }
        }
    }
}
