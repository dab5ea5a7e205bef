package com.walletledger.records;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Money spent from a wallet. Transfer source legs and commissions are expenses too.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ExpenseRecord extends LedgerRecord {

    public ExpenseRecord(long id, LocalDate date, long walletId, Long transferId,
                         Long commissionForTransferId, double amountOriginal, String currency,
                         double amountKzt, String category, String description) {
        super(id, date, walletId, transferId, commissionForTransferId, amountOriginal, currency,
            amountKzt, category, description);
    }

    @Override
    public RecordType getType() {
        return RecordType.EXPENSE;
    }
}
