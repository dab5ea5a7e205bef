package com.walletledger.imports;

import com.walletledger.records.LedgerRecord;
import lombok.Value;

/**
 * Result of parsing one row: a record, an initial balance, or an error message.
 */
@Value
public class ParsedRow {
    LedgerRecord record;
    Double initialBalance;
    String error;

    public static ParsedRow record(LedgerRecord record) {
        return new ParsedRow(record, null, null);
    }

    public static ParsedRow initialBalance(double balance) {
        return new ParsedRow(null, balance, null);
    }

    public static ParsedRow error(String error) {
        return new ParsedRow(null, null, error);
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isInitialBalance() {
        return initialBalance != null;
    }
}
