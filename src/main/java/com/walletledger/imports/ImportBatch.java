package com.walletledger.imports;

import com.walletledger.records.LedgerRecord;
import com.walletledger.transfers.Transfer;
import lombok.Value;

import java.util.List;

/**
 * Records and transfers parsed from a batch of rows, ready to replace the stored ones.
 */
@Value
public class ImportBatch {
    List<LedgerRecord> records;
    List<Transfer> transfers;

    /**
     * {@code null} when the batch had no {@code initial_balance} row.
     */
    Double initialBalance;

    ImportSummary summary;
}
