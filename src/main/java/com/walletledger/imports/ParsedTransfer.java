package com.walletledger.imports;

import com.walletledger.records.LedgerRecord;
import com.walletledger.transfers.Transfer;
import lombok.Value;

import java.util.List;

/**
 * Result of parsing a compact {@code transfer} row: the transfer with its expense and
 * income legs, or an error message.
 */
@Value
public class ParsedTransfer {
    Transfer transfer;
    List<LedgerRecord> legs;
    String error;

    public static ParsedTransfer of(Transfer transfer, LedgerRecord expenseLeg, LedgerRecord incomeLeg) {
        return new ParsedTransfer(transfer, List.of(expenseLeg, incomeLeg), null);
    }

    public static ParsedTransfer error(String error) {
        return new ParsedTransfer(null, List.of(), error);
    }

    public boolean isError() {
        return error != null;
    }
}
